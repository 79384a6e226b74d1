package com.phillippitts.voicecompanion.service.playback;

import com.phillippitts.voicecompanion.config.properties.PlaybackProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Strips mention tokens from chat text and bounds its length before speech.
 *
 * <p>Removed: {@code @everyone}, {@code @here}, role {@code <@&id>}, user {@code <@id>}/{@code <@!id>}
 * and channel {@code <#id>} tokens. Whitespace runs collapse to one space; the result is trimmed
 * and cut to {@code voice.playback.max-text-chars}.
 */
@Component
public class TextSanitizer {

    private static final Pattern BROADCAST = Pattern.compile("@(everyone|here)");
    private static final Pattern ROLE = Pattern.compile("<@&\\d+>");
    private static final Pattern USER = Pattern.compile("<@!?\\d+>");
    private static final Pattern CHANNEL = Pattern.compile("<#\\d+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int maxChars;

    @Autowired
    public TextSanitizer(PlaybackProperties props) {
        this(props.getMaxTextChars());
    }

    TextSanitizer(int maxChars) {
        this.maxChars = maxChars;
    }

    /**
     * @return sanitized text, possibly empty; never null
     */
    public String sanitize(String raw) {
        if (raw == null) {
            return "";
        }
        String s = BROADCAST.matcher(raw).replaceAll("");
        s = ROLE.matcher(s).replaceAll("");
        s = USER.matcher(s).replaceAll("");
        s = CHANNEL.matcher(s).replaceAll("");
        s = WHITESPACE.matcher(s).replaceAll(" ").trim();
        if (s.length() > maxChars) {
            s = s.substring(0, maxChars).trim();
        }
        return s;
    }
}
