package com.phillippitts.voicecompanion.service.voice.transport;

/**
 * Per-guild audio player. Plays one resource at a time.
 */
public interface AudioPlayer {

    void play(AudioResource resource);

    /** Stops the current resource immediately; the player returns to {@link PlayerStatus#IDLE}. */
    void stop();

    PlayerStatus status();

    void addListener(PlayerListener listener);

    void removeListener(PlayerListener listener);
}
