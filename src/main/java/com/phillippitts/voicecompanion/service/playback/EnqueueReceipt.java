package com.phillippitts.voicecompanion.service.playback;

import java.util.List;

/**
 * Result of an accepted enqueue call.
 *
 * @param items      items appended by this call, in order
 * @param queueDepth items waiting in the guild queue right after the append
 */
public record EnqueueReceipt(String guildId, List<QueueItem> items, int queueDepth) {

    public EnqueueReceipt {
        items = List.copyOf(items);
    }
}
