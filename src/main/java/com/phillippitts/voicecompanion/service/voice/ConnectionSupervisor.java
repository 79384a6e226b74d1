package com.phillippitts.voicecompanion.service.voice;

import com.phillippitts.voicecompanion.config.properties.VoiceConnectionProperties;
import com.phillippitts.voicecompanion.exception.ConnectionRejectedException;
import com.phillippitts.voicecompanion.exception.ConnectionTimeoutException;
import com.phillippitts.voicecompanion.exception.RetriesExhaustedException;
import com.phillippitts.voicecompanion.service.metrics.VoiceMetrics;
import com.phillippitts.voicecompanion.service.voice.event.VoiceConnectionLostEvent;
import com.phillippitts.voicecompanion.service.voice.event.VoiceJoinFailedEvent;
import com.phillippitts.voicecompanion.service.voice.event.VoiceSessionStateChangedEvent;
import com.phillippitts.voicecompanion.service.voice.transport.ConnectionStateListener;
import com.phillippitts.voicecompanion.service.voice.transport.ConnectionStatus;
import com.phillippitts.voicecompanion.service.voice.transport.VoiceChannel;
import com.phillippitts.voicecompanion.service.voice.transport.VoiceConnection;
import com.phillippitts.voicecompanion.service.voice.transport.VoiceTransport;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns one voice session per guild and is the only component that creates or destroys
 * voice connections.
 *
 * <p>Lifecycle operations ({@link #join}, {@link #move}, {@link #leave}, {@link #cleanup}) are
 * serialized per guild by the session lock; different guilds never contend. Reads
 * ({@link #getConnection}, {@link #getState}, {@link #isReady}) are lock-free and return the last
 * committed snapshot.
 *
 * <p>Connect model:
 * <ul>
 *   <li>{@code transport.connect} is bounded by {@code join-timeout-ms}; a connect that completes
 *       after its attempt was abandoned is destroyed</li>
 *   <li>the ready signal is bounded by {@code ready-timeout-ms}</li>
 *   <li>failed attempts back off exponentially with jitter, up to {@code max-retries} retries,
 *       after which the session is reset to IDLE and {@link RetriesExhaustedException} is thrown</li>
 * </ul>
 *
 * <p>Transport signals arrive through one {@link ConnectionStateListener} per connection, removed
 * when the supervisor destroys that connection. A disconnect that is not followed by a recovering
 * or ready signal within {@code disconnect-grace-ms} tears the connection down and resets the
 * session, provided the session still refers to that connection.
 *
 * @since 1.0
 */
@Service
public class ConnectionSupervisor {

    private static final Logger LOG = LogManager.getLogger(ConnectionSupervisor.class);

    private final VoiceTransport transport;
    private final VoiceConnectionProperties props;
    private final BackoffPolicy backoff;
    private final Executor connectExecutor;
    private final TaskScheduler scheduler;
    private final ApplicationEventPublisher publisher;
    private final VoiceMetrics metrics;

    private final ConcurrentMap<String, GuildVoiceSession> sessions = new ConcurrentHashMap<>();
    private final Map<VoiceConnection, ConnectionWatcher> watchers =
            Collections.synchronizedMap(new IdentityHashMap<>());

    public ConnectionSupervisor(VoiceTransport transport,
                                VoiceConnectionProperties props,
                                BackoffPolicy backoff,
                                @Qualifier("voiceConnectExecutor") Executor connectExecutor,
                                @Qualifier("voiceTaskScheduler") TaskScheduler scheduler,
                                ApplicationEventPublisher publisher,
                                VoiceMetrics metrics) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.props = Objects.requireNonNull(props, "props");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.connectExecutor = Objects.requireNonNull(connectExecutor, "connectExecutor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Connects the guild to a channel, waiting for the ready signal.
     *
     * <p>If the session is already READY on the same channel the existing connection is returned;
     * READY on another channel is handled as a move under the same lock acquisition.
     *
     * @param channel target channel
     * @return the ready connection
     * @throws RetriesExhaustedException when every attempt failed; the session is IDLE afterwards
     */
    public VoiceConnection join(VoiceChannel channel) {
        Objects.requireNonNull(channel, "channel");
        GuildVoiceSession session = sessionFor(channel.guildId());
        try (CloseableThreadContext.Instance ctc = CloseableThreadContext.put("guildId", channel.guildId())) {
            session.lock().lock();
            try {
                SessionSnapshot current = session.snapshot();
                if (current.state() == VoiceState.READY) {
                    VoiceConnection existing = current.connection();
                    if (channel.channelId().equals(current.channelId()) && !existing.isDestroyed()) {
                        LOG.debug("Already connected to channel {}", channel.channelId());
                        return existing;
                    }
                    return moveLocked(session, channel);
                }
                LOG.info("Joining voice channel {}", channel.channelId());
                return connectWithRetry(session, channel);
            } finally {
                session.lock().unlock();
            }
        }
    }

    /**
     * Tears down the current connection (if any) and connects to a new channel, holding the
     * guild lock for the whole sequence.
     *
     * @throws RetriesExhaustedException when every attempt failed; the session is IDLE afterwards
     */
    public VoiceConnection move(VoiceChannel channel) {
        Objects.requireNonNull(channel, "channel");
        GuildVoiceSession session = sessionFor(channel.guildId());
        try (CloseableThreadContext.Instance ctc = CloseableThreadContext.put("guildId", channel.guildId())) {
            session.lock().lock();
            try {
                return moveLocked(session, channel);
            } finally {
                session.lock().unlock();
            }
        }
    }

    /**
     * Disconnects the guild. No-op when no connection is held.
     */
    public void leave(String guildId) {
        GuildVoiceSession session = sessions.get(guildId);
        if (session == null) {
            return;
        }
        try (CloseableThreadContext.Instance ctc = CloseableThreadContext.put("guildId", guildId)) {
            session.lock().lock();
            try {
                SessionSnapshot current = session.snapshot();
                if (current.connection() == null) {
                    LOG.debug("Leave ignored: no connection");
                    return;
                }
                transition(session, SessionSnapshot.of(VoiceState.DISCONNECTING), current.channelId());
                destroyConnection(current.connection());
                session.resetRetries();
                transition(session, SessionSnapshot.IDLE, null);
                LOG.info("Left voice channel {}", current.channelId());
            } finally {
                session.lock().unlock();
            }
        }
    }

    public Optional<VoiceConnection> getConnection(String guildId) {
        return Optional.ofNullable(currentSnapshot(guildId).connection());
    }

    public Optional<String> getChannelId(String guildId) {
        return Optional.ofNullable(currentSnapshot(guildId).channelId());
    }

    public VoiceState getState(String guildId) {
        return currentSnapshot(guildId).state();
    }

    public boolean isReady(String guildId) {
        return currentSnapshot(guildId).state() == VoiceState.READY;
    }

    /**
     * Diagnostic view of one guild; an unknown guild reports IDLE.
     */
    public VoiceSessionStatus snapshot(String guildId) {
        GuildVoiceSession session = sessions.get(guildId);
        return session == null
                ? new VoiceSessionStatus(guildId, VoiceState.IDLE, null, 0, null)
                : session.status();
    }

    public List<VoiceSessionStatus> snapshotAll() {
        List<VoiceSessionStatus> out = new ArrayList<>();
        sessions.values().forEach(s -> out.add(s.status()));
        return out;
    }

    /**
     * Destroys the guild's connection and discards its session.
     */
    public void cleanup(String guildId) {
        GuildVoiceSession session = sessions.get(guildId);
        if (session == null) {
            return;
        }
        session.lock().lock();
        try {
            SessionSnapshot previous = session.commit(SessionSnapshot.IDLE);
            if (previous.connection() != null) {
                destroyConnection(previous.connection());
            }
            session.resetRetries();
            sessions.remove(guildId, session);
            if (previous.state() != VoiceState.IDLE) {
                publishStateChange(guildId, previous.state(), VoiceState.IDLE, null);
            }
            LOG.info("Voice session discarded for guild {}", guildId);
        } finally {
            session.lock().unlock();
        }
    }

    @PreDestroy
    public void cleanupAll() {
        List<String> guilds = new ArrayList<>(sessions.keySet());
        for (String guildId : guilds) {
            try {
                cleanup(guildId);
            } catch (RuntimeException e) {
                LOG.warn("Cleanup failed for guild {}: {}", guildId, e.toString());
            }
        }
        LOG.info("Voice sessions cleaned up: {}", guilds.size());
    }

    @Scheduled(fixedRate = 60_000)
    void logSessionSummary() {
        if (sessions.isEmpty()) {
            return;
        }
        Map<VoiceState, Integer> counts = new EnumMap<>(VoiceState.class);
        sessions.values().forEach(s -> counts.merge(s.snapshot().state(), 1, Integer::sum));
        LOG.info("Voice sessions: total={} byState={}", sessions.size(), counts);
    }

    private SessionSnapshot currentSnapshot(String guildId) {
        GuildVoiceSession session = sessions.get(guildId);
        return session == null ? SessionSnapshot.IDLE : session.snapshot();
    }

    private GuildVoiceSession sessionFor(String guildId) {
        return sessions.computeIfAbsent(guildId, GuildVoiceSession::new);
    }

    /** Caller must hold the session lock. */
    private VoiceConnection moveLocked(GuildVoiceSession session, VoiceChannel channel) {
        SessionSnapshot previous = transition(session, SessionSnapshot.of(VoiceState.MOVING), channel.channelId());
        if (previous.connection() != null) {
            destroyConnection(previous.connection());
        }
        LOG.info("Moving from channel {} to {}", previous.channelId(), channel.channelId());
        return connectWithRetry(session, channel);
    }

    /** Caller must hold the session lock. */
    private VoiceConnection connectWithRetry(GuildVoiceSession session, VoiceChannel channel) {
        while (true) {
            long attemptId = session.nextAttempt();
            transition(session, SessionSnapshot.of(VoiceState.CONNECTING), channel.channelId());
            RuntimeException failure;
            try {
                VoiceConnection connection = attemptOnce(session, channel, attemptId);
                session.resetRetries();
                transition(session, SessionSnapshot.ready(connection), channel.channelId());
                metrics.recordConnectAttempt("ready");
                LOG.info("Voice connection ready: channel={}, attempt={}", channel.channelId(), attemptId);
                return connection;
            } catch (ConnectionTimeoutException e) {
                metrics.recordConnectAttempt("timeout");
                failure = e;
            } catch (ConnectionRejectedException e) {
                metrics.recordConnectAttempt("rejected");
                failure = e;
            }
            session.recordError(failure);

            int retries = session.retries();
            if (retries < props.getMaxRetries() && !Thread.currentThread().isInterrupted()) {
                transition(session, SessionSnapshot.of(VoiceState.BACKOFF), channel.channelId());
                try {
                    long delay = backoff.pause(retries);
                    LOG.warn("Connect attempt {} failed ({}); retried after {}ms",
                            retries + 1, failure.getMessage(), delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw exhausted(session, channel, retries + 1, ie);
                }
                session.incrementRetries();
                metrics.incrementRetries();
                continue;
            }
            throw exhausted(session, channel, retries + 1, failure);
        }
    }

    private RetriesExhaustedException exhausted(GuildVoiceSession session, VoiceChannel channel,
                                                int attempts, Throwable cause) {
        session.resetRetries();
        session.recordError(cause);
        transition(session, SessionSnapshot.IDLE, null);
        metrics.recordConnectAttempt("exhausted");
        RetriesExhaustedException ex = new RetriesExhaustedException(
                channel.guildId(), channel.channelId(), attempts, cause);
        LOG.error("Giving up on voice channel {} after {} attempts: {}",
                channel.channelId(), attempts, String.valueOf(cause));
        publisher.publishEvent(new VoiceJoinFailedEvent(channel.guildId(), channel.channelId(),
                attempts, ex.getMessage(), cause, Instant.now()));
        return ex;
    }

    /**
     * One bounded connect plus bounded ready wait.
     */
    private VoiceConnection attemptOnce(GuildVoiceSession session, VoiceChannel channel, long attemptId) {
        String guildId = channel.guildId();
        CompletableFuture<VoiceConnection> pending;
        try {
            pending = CompletableFuture.supplyAsync(() -> transport.connect(channel), connectExecutor);
        } catch (RejectedExecutionException ree) {
            throw new ConnectionRejectedException(guildId, "No connect thread available", ree);
        }

        VoiceConnection connection;
        try {
            connection = pending.get(props.getJoinTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            pending.thenAccept(late -> discardLateConnection(session, late, attemptId));
            throw new ConnectionTimeoutException(guildId, "connect", props.joinTimeout());
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof ConnectionRejectedException rejected) {
                throw rejected;
            }
            throw new ConnectionRejectedException(guildId, "Transport connect failed", cause);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            pending.thenAccept(late -> discardLateConnection(session, late, attemptId));
            throw new ConnectionRejectedException(guildId, "Interrupted while connecting", ie);
        }
        if (connection == null) {
            throw new ConnectionRejectedException(guildId, "Transport returned no connection");
        }

        ConnectionWatcher watcher = watch(session, connection);
        if (connection.status() == ConnectionStatus.READY) {
            watcher.readySignal.complete(connection);
        }
        try {
            watcher.readySignal.get(props.getReadyTimeoutMs(), TimeUnit.MILLISECONDS);
            return connection;
        } catch (TimeoutException te) {
            destroyConnection(connection);
            throw new ConnectionTimeoutException(guildId, "ready", props.readyTimeout());
        } catch (ExecutionException ee) {
            destroyConnection(connection);
            throw new ConnectionRejectedException(guildId, "Connection closed before ready", ee.getCause());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            destroyConnection(connection);
            throw new ConnectionRejectedException(guildId, "Interrupted while waiting for ready", ie);
        }
    }

    private void discardLateConnection(GuildVoiceSession session, VoiceConnection late, long attemptId) {
        if (late == null) {
            return;
        }
        SessionSnapshot current = session.snapshot();
        if (session.currentAttempt() == attemptId && current.connection() == late) {
            return;
        }
        LOG.info("Destroying connection that completed after its attempt {} was abandoned (guild {})",
                attemptId, session.guildId());
        metrics.recordConnectAttempt("superseded");
        destroyConnection(late);
    }

    private ConnectionWatcher watch(GuildVoiceSession session, VoiceConnection connection) {
        ConnectionWatcher watcher = new ConnectionWatcher(session, connection);
        if (watchers.putIfAbsent(connection, watcher) != null) {
            return watchers.get(connection);
        }
        connection.addListener(watcher);
        return watcher;
    }

    /**
     * Best-effort teardown: unregisters the watcher, then destroys. Failures are logged.
     */
    private void destroyConnection(VoiceConnection connection) {
        ConnectionWatcher watcher = watchers.remove(connection);
        if (watcher != null) {
            watcher.cancelGrace();
            connection.removeListener(watcher);
        }
        try {
            connection.destroy();
        } catch (RuntimeException e) {
            LOG.warn("Destroying voice connection failed: {}", e.toString());
        }
    }

    /**
     * Commits a snapshot and publishes the state change.
     *
     * @return the replaced snapshot
     */
    private SessionSnapshot transition(GuildVoiceSession session, SessionSnapshot next, String channelId) {
        SessionSnapshot previous = session.commit(next);
        if (previous.state() != next.state()) {
            LOG.debug("Session {} -> {}", previous.state(), next.state());
            publishStateChange(session.guildId(), previous.state(), next.state(), channelId);
        }
        return previous;
    }

    private void publishStateChange(String guildId, VoiceState from, VoiceState to, String channelId) {
        publisher.publishEvent(new VoiceSessionStateChangedEvent(guildId, from, to, channelId, Instant.now()));
    }

    /**
     * Resets the session to IDLE only if it still holds exactly this connection.
     */
    private void declareLost(GuildVoiceSession session, VoiceConnection connection, String reason) {
        SessionSnapshot current = session.snapshot();
        boolean wasCurrent = current.connection() == connection
                && session.compareAndCommit(current, SessionSnapshot.IDLE);
        destroyConnection(connection);
        if (!wasCurrent) {
            LOG.debug("Ignoring loss of a connection no longer bound to guild {}", session.guildId());
            return;
        }
        session.resetRetries();
        metrics.incrementConnectionLost();
        LOG.warn("Voice connection lost in guild {} (channel {}): {}",
                session.guildId(), current.channelId(), reason);
        publishStateChange(session.guildId(), VoiceState.READY, VoiceState.IDLE, null);
        publisher.publishEvent(new VoiceConnectionLostEvent(session.guildId(), current.channelId(),
                reason, Instant.now()));
    }

    /**
     * Per-connection observer: completes the ready wait and runs the disconnect grace window.
     */
    private final class ConnectionWatcher implements ConnectionStateListener {

        private final GuildVoiceSession session;
        private final VoiceConnection connection;
        private final CompletableFuture<VoiceConnection> readySignal = new CompletableFuture<>();
        private ScheduledFuture<?> graceCheck;

        ConnectionWatcher(GuildVoiceSession session, VoiceConnection connection) {
            this.session = session;
            this.connection = connection;
        }

        @Override
        public void onReady(VoiceConnection c) {
            readySignal.complete(c);
            cancelGrace();
        }

        @Override
        public void onRecovering(VoiceConnection c) {
            cancelGrace();
        }

        @Override
        public synchronized void onDisconnected(VoiceConnection c) {
            if (!readySignal.isDone() || graceCheck != null) {
                return;
            }
            LOG.info("Voice connection disconnected in guild {}; waiting {}ms for recovery",
                    session.guildId(), props.getDisconnectGraceMs());
            graceCheck = scheduler.schedule(this::graceExpired,
                    Instant.now().plusMillis(props.getDisconnectGraceMs()));
        }

        @Override
        public void onDestroyed(VoiceConnection c) {
            if (!readySignal.isDone()) {
                readySignal.completeExceptionally(new ConnectionRejectedException(session.guildId(),
                        "Connection destroyed before ready"));
                return;
            }
            declareLost(session, connection, "destroyed by transport");
        }

        synchronized void cancelGrace() {
            if (graceCheck != null) {
                graceCheck.cancel(false);
                graceCheck = null;
            }
        }

        private void graceExpired() {
            synchronized (this) {
                if (graceCheck == null) {
                    return;
                }
                graceCheck = null;
            }
            if (connection.status() == ConnectionStatus.READY) {
                return;
            }
            declareLost(session, connection, "no recovery within " + props.getDisconnectGraceMs() + "ms");
        }
    }
}
