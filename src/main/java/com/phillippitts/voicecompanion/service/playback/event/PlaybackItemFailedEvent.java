package com.phillippitts.voicecompanion.service.playback.event;

import java.time.Instant;

/**
 * Published when a queue item is dropped because it could not be synthesized, built or started.
 *
 * <p>PII note: carries the item kind and sequence only, never the text.
 */
public record PlaybackItemFailedEvent(
        String guildId,
        long sequenceId,
        String kind,
        String reason,
        Throwable cause,
        Instant at
) {
    public PlaybackItemFailedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
