package com.phillippitts.voicecompanion.service.playback;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Fixed-size ring of the most recent audio items for one guild. Thread-safe.
 */
final class RecentAudioHistory {

    private final int maxItems;
    private final Deque<RecentAudio> items = new ArrayDeque<>();

    RecentAudioHistory(int maxItems) {
        if (maxItems <= 0) {
            throw new IllegalArgumentException("maxItems must be positive");
        }
        this.maxItems = maxItems;
    }

    synchronized void add(RecentAudio audio) {
        items.addLast(audio);
        while (items.size() > maxItems) {
            items.removeFirst();
        }
    }

    /** Oldest first. */
    synchronized List<RecentAudio> snapshot() {
        return List.copyOf(items);
    }

    synchronized void clear() {
        items.clear();
    }
}
