package com.phillippitts.voicecompanion.exception;

/**
 * Thrown when text submitted for playback has nothing left to speak after sanitization.
 */
public class EmptyInputException extends VoiceCompanionException {

    private final String guildId;

    public EmptyInputException(String guildId) {
        super("Text is empty after sanitization (guild: " + guildId + ")");
        this.guildId = guildId;
    }

    public String getGuildId() {
        return guildId;
    }
}
