package com.phillippitts.voicecompanion.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncateHandlesNullAndNonPositiveMax() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("abc", 0)).isEmpty();
    }

    @Test
    void truncateKeepsShortStrings() {
        assertThat(LogSanitizer.truncate("abc", 10)).isEqualTo("abc");
        assertThat(LogSanitizer.truncate("abcdef", 3)).isEqualTo("abc");
    }

    @Test
    void previewFlattensWhitespace() {
        assertThat(LogSanitizer.preview("line one\nline\ttwo")).isEqualTo("line one line two");
    }

    @Test
    void previewTruncatesLongTextWithLength() {
        String text = "x".repeat(100);

        String preview = LogSanitizer.preview(text);

        assertThat(preview).startsWith("x".repeat(LogSanitizer.PREVIEW_CHARS));
        assertThat(preview).endsWith("...(100 chars)");
    }
}
