package com.phillippitts.voicecompanion.service.playback;

import com.phillippitts.voicecompanion.service.voice.transport.AudioPlayer;
import com.phillippitts.voicecompanion.service.voice.transport.AudioSubscription;
import com.phillippitts.voicecompanion.service.voice.transport.PlayerListener;
import com.phillippitts.voicecompanion.service.voice.transport.VoiceConnection;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-guild playback bookkeeping owned by {@link PlaybackQueue}.
 * All mutable fields are guarded by {@link #lock}.
 */
final class PlaybackState {

    final String guildId;
    final ReentrantLock lock = new ReentrantLock();
    final Deque<QueueItem> queue = new ArrayDeque<>();
    final RecentAudioHistory recentAudio;

    boolean processing;
    AudioPlayer player;
    PlayerListener playerListener;
    AudioSubscription subscription;
    VoiceConnection currentConnection;
    long lastAcceptedAtMs = Long.MIN_VALUE;
    private long sequence;

    PlaybackState(String guildId, int recentAudioMaxItems) {
        this.guildId = guildId;
        this.recentAudio = new RecentAudioHistory(recentAudioMaxItems);
    }

    /** Caller must hold the lock. */
    long nextSequence() {
        return ++sequence;
    }
}
