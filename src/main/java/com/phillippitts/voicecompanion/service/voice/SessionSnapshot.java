package com.phillippitts.voicecompanion.service.voice;

import com.phillippitts.voicecompanion.service.voice.transport.VoiceConnection;

import java.util.Objects;

/**
 * State, connection and channel of a guild session, published together.
 *
 * <p>A connection is present exactly when the state is {@link VoiceState#READY}, and the channel id
 * is present exactly when the connection is.
 */
public record SessionSnapshot(VoiceState state, VoiceConnection connection, String channelId) {

    static final SessionSnapshot IDLE = new SessionSnapshot(VoiceState.IDLE, null, null);

    public SessionSnapshot {
        Objects.requireNonNull(state, "state");
        if ((connection != null) != (state == VoiceState.READY)) {
            throw new IllegalStateException("connection must be present only in READY, state=" + state);
        }
        if ((channelId != null) != (connection != null)) {
            throw new IllegalStateException("channelId must be present only with a connection");
        }
    }

    static SessionSnapshot of(VoiceState state) {
        return state == VoiceState.IDLE ? IDLE : new SessionSnapshot(state, null, null);
    }

    static SessionSnapshot ready(VoiceConnection connection) {
        return new SessionSnapshot(VoiceState.READY, connection, connection.channel().channelId());
    }
}
