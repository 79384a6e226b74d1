package com.phillippitts.voicecompanion.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the HTTP speech synthesizer.
 *
 * <p>Defaults target the public translate TTS endpoint with Spanish voice, one retry and a
 * 200-entry in-memory cache.
 *
 * @since 1.0
 */
@Validated
@ConfigurationProperties(prefix = "tts")
public class TtsProperties {

    public static final String DEFAULT_ENDPOINT = "https://translate.google.com/translate_tts";

    @NotBlank
    private final String lang;

    @NotBlank
    private final String endpoint;

    @Positive
    private final int timeoutMs;

    /** Extra attempts after the first failed request. */
    @Min(0)
    @Max(5)
    private final int retries;

    @Min(0)
    private final int cacheMaxEntries;

    @ConstructorBinding
    public TtsProperties(String lang,
                         String endpoint,
                         Integer timeoutMs,
                         Integer retries,
                         Integer cacheMaxEntries) {
        this.lang = (lang == null || lang.isBlank()) ? "es" : lang;
        this.endpoint = (endpoint == null || endpoint.isBlank()) ? DEFAULT_ENDPOINT : endpoint;
        this.timeoutMs = timeoutMs == null ? 15_000 : timeoutMs;
        this.retries = retries == null ? 1 : retries;
        this.cacheMaxEntries = cacheMaxEntries == null ? 200 : cacheMaxEntries;
    }

    public String getLang() {
        return lang;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    public int getRetries() {
        return retries;
    }

    public int getCacheMaxEntries() {
        return cacheMaxEntries;
    }
}
