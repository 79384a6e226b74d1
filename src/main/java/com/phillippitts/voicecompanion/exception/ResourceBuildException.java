package com.phillippitts.voicecompanion.exception;

/**
 * Thrown when audio bytes cannot be turned into a playable resource
 * (empty payload or unrecognized container).
 */
public class ResourceBuildException extends VoiceCompanionException {

    private final String resourceName;

    public ResourceBuildException(String resourceName, String reason) {
        super("Cannot build playable resource '" + resourceName + "': " + reason);
        this.resourceName = resourceName;
    }

    public String getResourceName() {
        return resourceName;
    }
}
