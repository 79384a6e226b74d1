package com.phillippitts.voicecompanion.service.voice.transport;

/**
 * Observer of audio player transitions and errors.
 */
public interface PlayerListener {

    void onStatusChanged(PlayerStatus oldStatus, PlayerStatus newStatus);

    void onError(AudioResource resource, Throwable error);
}
