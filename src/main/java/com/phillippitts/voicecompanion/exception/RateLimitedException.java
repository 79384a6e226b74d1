package com.phillippitts.voicecompanion.exception;

/**
 * Thrown when a playback request arrives sooner than the configured minimum interval after the
 * previous accepted request for the same guild.
 */
public class RateLimitedException extends VoiceCompanionException {

    private final String guildId;
    private final long retryAfterMs;

    public RateLimitedException(String guildId, long retryAfterMs) {
        super("Rate limit: please wait before sending another request (guild: " + guildId + ")");
        this.guildId = guildId;
        this.retryAfterMs = retryAfterMs;
    }

    public String getGuildId() {
        return guildId;
    }

    public long getRetryAfterMs() {
        return retryAfterMs;
    }
}
