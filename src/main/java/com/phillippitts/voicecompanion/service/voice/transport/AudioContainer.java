package com.phillippitts.voicecompanion.service.voice.transport;

/**
 * Audio container formats the player accepts.
 */
public enum AudioContainer {
    WAV,
    MP3,
    OGG
}
