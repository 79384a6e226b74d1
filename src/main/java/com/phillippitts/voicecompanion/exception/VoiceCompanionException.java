package com.phillippitts.voicecompanion.exception;

/**
 * Base exception for all voice-companion application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class VoiceCompanionException extends RuntimeException {

    public VoiceCompanionException(String message) {
        super(message);
    }

    public VoiceCompanionException(String message, Throwable cause) {
        super(message, cause);
    }

    public VoiceCompanionException(Throwable cause) {
        super(cause);
    }
}
