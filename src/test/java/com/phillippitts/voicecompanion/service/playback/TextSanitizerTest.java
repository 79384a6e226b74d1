package com.phillippitts.voicecompanion.service.playback;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextSanitizerTest {

    private final TextSanitizer sanitizer = new TextSanitizer(200);

    @Test
    void removesMentionsAndCollapsesWhitespace() {
        assertThat(sanitizer.sanitize("Hello <@123> check this @everyone")).isEqualTo("Hello check this");
    }

    @Test
    void removesEveryMentionForm() {
        String raw = "@here <@!42> <@&77> <#99> hi";

        assertThat(sanitizer.sanitize(raw)).isEqualTo("hi");
    }

    @Test
    void mentionOnlyTextBecomesEmpty() {
        assertThat(sanitizer.sanitize("<@1> @everyone")).isEmpty();
        assertThat(sanitizer.sanitize("   ")).isEmpty();
        assertThat(sanitizer.sanitize(null)).isEmpty();
    }

    @Test
    void truncatesToMaximumLength() {
        TextSanitizer shortSanitizer = new TextSanitizer(10);

        assertThat(shortSanitizer.sanitize("abcdefghij klmnop")).isEqualTo("abcdefghij");
        assertThat(shortSanitizer.sanitize("abcd efgh ijkl")).isEqualTo("abcd efgh");
    }
}
