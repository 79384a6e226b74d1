package com.phillippitts.voicecompanion.service.voice;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable per-guild lifecycle record owned by {@link ConnectionSupervisor}.
 *
 * <p>The lock serializes join/move/leave/cleanup. The snapshot may be read without the lock; it
 * is replaced while the lock is held, except by the connection-loss path, which uses a
 * compare-and-set against the exact snapshot it observed.
 */
final class GuildVoiceSession {

    private final String guildId;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicReference<SessionSnapshot> snapshot = new AtomicReference<>(SessionSnapshot.IDLE);
    private final AtomicLong attempt = new AtomicLong();

    private volatile int retries;
    private volatile Throwable lastError;

    GuildVoiceSession(String guildId) {
        this.guildId = Objects.requireNonNull(guildId, "guildId");
    }

    String guildId() {
        return guildId;
    }

    ReentrantLock lock() {
        return lock;
    }

    SessionSnapshot snapshot() {
        return snapshot.get();
    }

    /**
     * Replaces the snapshot unconditionally. Caller must hold the lock.
     *
     * @return the snapshot that was replaced
     */
    SessionSnapshot commit(SessionSnapshot next) {
        return snapshot.getAndSet(next);
    }

    boolean compareAndCommit(SessionSnapshot expected, SessionSnapshot next) {
        return snapshot.compareAndSet(expected, next);
    }

    long nextAttempt() {
        return attempt.incrementAndGet();
    }

    long currentAttempt() {
        return attempt.get();
    }

    int retries() {
        return retries;
    }

    void incrementRetries() {
        retries++;
    }

    void resetRetries() {
        retries = 0;
    }

    Throwable lastError() {
        return lastError;
    }

    void recordError(Throwable error) {
        lastError = error;
    }

    VoiceSessionStatus status() {
        SessionSnapshot s = snapshot.get();
        Throwable err = lastError();
        return new VoiceSessionStatus(guildId, s.state(), s.channelId(), retries,
                err == null ? null : err.getMessage());
    }
}
