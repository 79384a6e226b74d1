package com.phillippitts.voicecompanion.exception;

/**
 * Thrown by join/move once every connect attempt for a channel has failed.
 *
 * <p>This is the only lifecycle failure surfaced to callers. When it is thrown the guild
 * session has already been reset to idle; {@link #getCause()} holds the last attempt's failure.
 */
public class RetriesExhaustedException extends VoiceCompanionException {

    private final String guildId;
    private final String channelId;
    private final int attempts;

    public RetriesExhaustedException(String guildId, String channelId, int attempts, Throwable lastError) {
        super("Could not connect to voice channel " + channelId + " after " + attempts
                + " attempts (guild: " + guildId + ")", lastError);
        this.guildId = guildId;
        this.channelId = channelId;
        this.attempts = attempts;
    }

    public String getGuildId() {
        return guildId;
    }

    public String getChannelId() {
        return channelId;
    }

    public int getAttempts() {
        return attempts;
    }
}
