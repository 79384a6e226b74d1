package com.phillippitts.voicecompanion.service.voice;

/**
 * Lifecycle state of a guild voice session.
 *
 * <p>{@link #READY} is the only state in which a connection is held and audio may play.
 * {@link #BACKOFF} always leads back to {@link #CONNECTING} or {@link #IDLE}.
 */
public enum VoiceState {
    IDLE,
    CONNECTING,
    READY,
    MOVING,
    DISCONNECTING,
    BACKOFF;

    /**
     * Whether a join or move is underway, so a missing connection is expected to come back.
     */
    public boolean isTransitioning() {
        return this == CONNECTING || this == MOVING || this == BACKOFF;
    }
}
