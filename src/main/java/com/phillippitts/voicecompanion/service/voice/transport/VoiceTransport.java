package com.phillippitts.voicecompanion.service.voice.transport;

import com.phillippitts.voicecompanion.exception.ConnectionRejectedException;

/**
 * Narrow seam over the platform voice gateway.
 *
 * <p>Implementations handle wire protocol and encryption. The supervisor is the only caller of
 * {@link #connect(VoiceChannel)}; the playback queue is the only caller of
 * {@link #createPlayer(String)}.
 */
public interface VoiceTransport {

    /**
     * Begins connecting to a channel. The returned connection later signals
     * {@link ConnectionStateListener#onReady(VoiceConnection)} or fails.
     *
     * @throws ConnectionRejectedException if the gateway refuses the request outright
     */
    VoiceConnection connect(VoiceChannel channel);

    /**
     * Creates the single audio player used for a guild.
     */
    AudioPlayer createPlayer(String guildId);
}
