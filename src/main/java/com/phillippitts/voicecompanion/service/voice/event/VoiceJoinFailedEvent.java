package com.phillippitts.voicecompanion.service.voice.event;

import java.time.Instant;

/**
 * Published when join or move gives up on a channel after exhausting retries.
 */
public record VoiceJoinFailedEvent(
        String guildId,
        String channelId,
        int attempts,
        String message,
        Throwable cause,
        Instant at
) {
    public VoiceJoinFailedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
