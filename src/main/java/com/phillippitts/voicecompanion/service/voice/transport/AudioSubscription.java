package com.phillippitts.voicecompanion.service.voice.transport;

/**
 * Binding of one {@link AudioPlayer} to one {@link VoiceConnection}.
 */
public interface AudioSubscription {

    VoiceConnection connection();

    void unsubscribe();
}
