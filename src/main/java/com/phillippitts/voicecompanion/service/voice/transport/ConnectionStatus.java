package com.phillippitts.voicecompanion.service.voice.transport;

/**
 * Wire-level status reported by a {@link VoiceConnection}.
 */
public enum ConnectionStatus {
    SIGNALLING,
    CONNECTING,
    READY,
    DISCONNECTED,
    DESTROYED
}
