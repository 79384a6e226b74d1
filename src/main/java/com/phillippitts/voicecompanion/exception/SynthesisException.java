package com.phillippitts.voicecompanion.exception;

/**
 * Thrown when a speech synthesizer cannot produce audio (network error, timeout, bad response).
 */
public class SynthesisException extends VoiceCompanionException {

    private final String provider;

    public SynthesisException(String message, String provider) {
        super(message + " (provider: " + provider + ")");
        this.provider = provider;
    }

    public SynthesisException(String message, String provider, Throwable cause) {
        super(message + " (provider: " + provider + ")", cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
