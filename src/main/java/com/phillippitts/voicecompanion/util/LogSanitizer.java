package com.phillippitts.voicecompanion.util;

/** Utility for privacy-safe logging of spoken text. */
public final class LogSanitizer {

    /** Characters of user text allowed into INFO/WARN logs. */
    public static final int PREVIEW_CHARS = 40;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Single-line preview of user text, suffixed with the original length when truncated.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String oneLine = s.replaceAll("[\\r\\n\\t]+", " ");
        if (oneLine.length() <= PREVIEW_CHARS) {
            return oneLine;
        }
        return truncate(oneLine, PREVIEW_CHARS) + "...(" + oneLine.length() + " chars)";
    }
}
