package com.phillippitts.voicecompanion.service.voice.event;

import com.phillippitts.voicecompanion.service.voice.VoiceState;

import java.time.Instant;

/**
 * Published whenever a guild session commits a new state.
 *
 * @param channelId bound channel when {@code to} is READY, otherwise the channel being targeted (may be null)
 */
public record VoiceSessionStateChangedEvent(
        String guildId,
        VoiceState from,
        VoiceState to,
        String channelId,
        Instant at
) {
    public VoiceSessionStateChangedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
