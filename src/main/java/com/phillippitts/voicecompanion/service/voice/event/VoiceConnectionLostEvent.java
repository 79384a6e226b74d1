package com.phillippitts.voicecompanion.service.voice.event;

import java.time.Instant;

/**
 * Published when a live connection is torn down without a lifecycle call
 * (disconnect grace expired or the transport destroyed it).
 */
public record VoiceConnectionLostEvent(
        String guildId,
        String channelId,
        String reason,
        Instant at
) {
    public VoiceConnectionLostEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
