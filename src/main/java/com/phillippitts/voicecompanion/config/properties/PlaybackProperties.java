package com.phillippitts.voicecompanion.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the per-guild playback queue.
 *
 * Privacy defaults: INFO logs only ever carry truncated previews of spoken text.
 */
@Validated
@ConfigurationProperties(prefix = "voice.playback")
public class PlaybackProperties {

    /** Minimum spacing between accepted enqueue calls for one guild. */
    @Min(0)
    private final long minRequestIntervalMs;

    @Min(1)
    @Max(2000)
    private final int maxTextChars;

    @Positive
    private final long playStartTimeoutMs;

    @Min(1)
    @Max(100)
    private final int recentAudioMaxItems;

    /** Directory holding {@code <key>.wav|mp3|ogg|opus} sound effects. */
    @NotBlank
    private final String soundsDir;

    @ConstructorBinding
    public PlaybackProperties(Long minRequestIntervalMs,
                              Integer maxTextChars,
                              Long playStartTimeoutMs,
                              Integer recentAudioMaxItems,
                              String soundsDir) {
        this.minRequestIntervalMs = minRequestIntervalMs == null ? 200L : minRequestIntervalMs;
        this.maxTextChars = maxTextChars == null ? 200 : maxTextChars;
        this.playStartTimeoutMs = playStartTimeoutMs == null ? 7_000L : playStartTimeoutMs;
        this.recentAudioMaxItems = recentAudioMaxItems == null ? 10 : recentAudioMaxItems;
        this.soundsDir = (soundsDir == null || soundsDir.isBlank()) ? "sounds" : soundsDir;
    }

    public long getMinRequestIntervalMs() {
        return minRequestIntervalMs;
    }

    public int getMaxTextChars() {
        return maxTextChars;
    }

    public long getPlayStartTimeoutMs() {
        return playStartTimeoutMs;
    }

    public int getRecentAudioMaxItems() {
        return recentAudioMaxItems;
    }

    public String getSoundsDir() {
        return soundsDir;
    }
}
