package com.phillippitts.voicecompanion.service.voice.transport;

/**
 * Handle to one live (or establishing) voice connection.
 */
public interface VoiceConnection {

    VoiceChannel channel();

    ConnectionStatus status();

    default boolean isDestroyed() {
        return status() == ConnectionStatus.DESTROYED;
    }

    /**
     * Attaches a player so its output is sent on this connection.
     *
     * @return the subscription, or {@code null} if the connection cannot accept one
     */
    AudioSubscription subscribe(AudioPlayer player);

    void addListener(ConnectionStateListener listener);

    void removeListener(ConnectionStateListener listener);

    /**
     * Tears the connection down. Idempotent.
     */
    void destroy();
}
