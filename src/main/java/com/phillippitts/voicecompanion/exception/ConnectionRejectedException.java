package com.phillippitts.voicecompanion.exception;

/**
 * Thrown when the voice transport refuses or aborts a connect attempt.
 */
public class ConnectionRejectedException extends VoiceCompanionException {

    private final String guildId;

    public ConnectionRejectedException(String guildId, String message) {
        super(message + " (guild: " + guildId + ")");
        this.guildId = guildId;
    }

    public ConnectionRejectedException(String guildId, String message, Throwable cause) {
        super(message + " (guild: " + guildId + ")", cause);
        this.guildId = guildId;
    }

    public String getGuildId() {
        return guildId;
    }
}
