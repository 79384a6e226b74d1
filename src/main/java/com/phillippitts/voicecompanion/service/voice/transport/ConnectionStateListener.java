package com.phillippitts.voicecompanion.service.voice.transport;

/**
 * Observer of connection status signals. Callbacks may arrive on transport threads.
 */
public interface ConnectionStateListener {

    default void onReady(VoiceConnection connection) {
    }

    default void onDisconnected(VoiceConnection connection) {
    }

    /** Transport is re-establishing (signalling or connecting) after a disconnect. */
    default void onRecovering(VoiceConnection connection) {
    }

    default void onDestroyed(VoiceConnection connection) {
    }
}
