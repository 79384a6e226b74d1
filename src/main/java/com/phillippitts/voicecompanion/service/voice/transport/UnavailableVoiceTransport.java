package com.phillippitts.voicecompanion.service.voice.transport;

import com.phillippitts.voicecompanion.exception.ConnectionRejectedException;

/**
 * Fallback transport registered when no gateway adapter is present.
 *
 * <p>Every connect is rejected so join/move exhaust their retries and report a clean failure
 * instead of the application refusing to start.
 */
public class UnavailableVoiceTransport implements VoiceTransport {

    @Override
    public VoiceConnection connect(VoiceChannel channel) {
        throw new ConnectionRejectedException(channel.guildId(), "No voice transport adapter is configured");
    }

    @Override
    public AudioPlayer createPlayer(String guildId) {
        throw new IllegalStateException("No voice transport adapter is configured (guild: " + guildId + ")");
    }
}
