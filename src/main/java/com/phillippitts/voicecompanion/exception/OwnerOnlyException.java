package com.phillippitts.voicecompanion.exception;

/**
 * Thrown when a control request does not come from the configured owner.
 */
public class OwnerOnlyException extends VoiceCompanionException {

    public OwnerOnlyException() {
        super("Access denied: only the owner can use this endpoint");
    }
}
