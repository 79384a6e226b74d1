package com.phillippitts.voicecompanion.service.playback;

import java.time.Instant;

/**
 * Audio bytes that were handed to the player, kept for replay/export.
 */
public record RecentAudio(String name, byte[] data, Instant at) {

    public int size() {
        return data.length;
    }
}
