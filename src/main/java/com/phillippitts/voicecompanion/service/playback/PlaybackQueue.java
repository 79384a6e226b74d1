package com.phillippitts.voicecompanion.service.playback;

import com.phillippitts.voicecompanion.config.properties.PlaybackProperties;
import com.phillippitts.voicecompanion.exception.EmptyInputException;
import com.phillippitts.voicecompanion.exception.RateLimitedException;
import com.phillippitts.voicecompanion.exception.ResourceBuildException;
import com.phillippitts.voicecompanion.exception.SynthesisException;
import com.phillippitts.voicecompanion.service.metrics.VoiceMetrics;
import com.phillippitts.voicecompanion.service.playback.event.PlaybackItemFailedEvent;
import com.phillippitts.voicecompanion.service.tts.AudioSynthesizer;
import com.phillippitts.voicecompanion.service.voice.ConnectionSupervisor;
import com.phillippitts.voicecompanion.service.voice.VoiceState;
import com.phillippitts.voicecompanion.service.voice.event.VoiceSessionStateChangedEvent;
import com.phillippitts.voicecompanion.service.voice.transport.AudioPlayer;
import com.phillippitts.voicecompanion.service.voice.transport.AudioResource;
import com.phillippitts.voicecompanion.service.voice.transport.AudioSubscription;
import com.phillippitts.voicecompanion.service.voice.transport.PlayerListener;
import com.phillippitts.voicecompanion.service.voice.transport.PlayerStatus;
import com.phillippitts.voicecompanion.service.voice.transport.VoiceConnection;
import com.phillippitts.voicecompanion.service.voice.transport.VoiceTransport;
import com.phillippitts.voicecompanion.util.LogSanitizer;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Ordered per-guild playback of speech and sound effects.
 *
 * <p>Each guild has one FIFO queue and one audio player. Processing is single-flight per guild:
 * one item is synthesized and started at a time, and the player's idle/error signal triggers the
 * next one. The queue never changes supervisor state; it only reads the current connection.
 *
 * <p>Connection used for an item, in order of preference:
 * <ol>
 *   <li>the supervisor's connection when the guild is READY</li>
 *   <li>the connection passed to the last {@link #enqueue} call, if not destroyed</li>
 * </ol>
 * With neither available the queue is kept while a join/move is in progress (processing resumes
 * on the next state change) and dropped otherwise.
 *
 * @since 1.0
 */
@Service
public class PlaybackQueue {

    private static final Logger LOG = LogManager.getLogger(PlaybackQueue.class);

    private final ConnectionSupervisor supervisor;
    private final VoiceTransport transport;
    private final AudioSynthesizer synthesizer;
    private final TextSanitizer sanitizer;
    private final TextSegmenter segmenter;
    private final AudioResourceFactory resources;
    private final PlaybackProperties props;
    private final Executor playbackExecutor;
    private final ApplicationEventPublisher publisher;
    private final VoiceMetrics metrics;
    private final Clock clock;

    private final ConcurrentMap<String, PlaybackState> states = new ConcurrentHashMap<>();

    @Autowired
    public PlaybackQueue(ConnectionSupervisor supervisor,
                         VoiceTransport transport,
                         AudioSynthesizer synthesizer,
                         TextSanitizer sanitizer,
                         TextSegmenter segmenter,
                         AudioResourceFactory resources,
                         PlaybackProperties props,
                         @Qualifier("playbackExecutor") Executor playbackExecutor,
                         ApplicationEventPublisher publisher,
                         VoiceMetrics metrics) {
        this(supervisor, transport, synthesizer, sanitizer, segmenter, resources, props,
                playbackExecutor, publisher, metrics, Clock.systemUTC());
    }

    public PlaybackQueue(ConnectionSupervisor supervisor,
                         VoiceTransport transport,
                         AudioSynthesizer synthesizer,
                         TextSanitizer sanitizer,
                         TextSegmenter segmenter,
                         AudioResourceFactory resources,
                         PlaybackProperties props,
                         Executor playbackExecutor,
                         ApplicationEventPublisher publisher,
                         VoiceMetrics metrics,
                         Clock clock) {
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer");
        this.segmenter = Objects.requireNonNull(segmenter, "segmenter");
        this.resources = Objects.requireNonNull(resources, "resources");
        this.props = Objects.requireNonNull(props, "props");
        this.playbackExecutor = Objects.requireNonNull(playbackExecutor, "playbackExecutor");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Sanitizes, segments and appends text to the guild queue, then starts processing.
     *
     * @param connection the connection the caller expects playback on; recorded as current
     * @throws RateLimitedException if called within {@code min-request-interval-ms} of the last accepted call
     * @throws EmptyInputException if nothing remains after sanitization (queue untouched)
     */
    public EnqueueReceipt enqueue(String guildId, String rawText, VoiceConnection connection) {
        Objects.requireNonNull(guildId, "guildId");
        Objects.requireNonNull(connection, "connection");
        PlaybackState state = stateFor(guildId);
        List<QueueItem> items;
        int depth;
        state.lock.lock();
        try {
            long now = clock.millis();
            if (state.lastAcceptedAtMs != Long.MIN_VALUE) {
                long elapsed = now - state.lastAcceptedAtMs;
                if (elapsed < props.getMinRequestIntervalMs()) {
                    throw new RateLimitedException(guildId, props.getMinRequestIntervalMs() - elapsed);
                }
            }
            state.lastAcceptedAtMs = now;
            state.currentConnection = connection;

            String text = sanitizer.sanitize(rawText);
            if (text.isEmpty()) {
                throw new EmptyInputException(guildId);
            }
            items = segmenter.segment(text, state::nextSequence);
            state.queue.addAll(items);
            depth = state.queue.size();

            ensurePlayer(state);
            bind(state, connection);
        } finally {
            state.lock.unlock();
        }
        LOG.info("Enqueued {} item(s) for guild {}: '{}' (depth {})",
                items.size(), guildId, LogSanitizer.preview(rawText), depth);
        triggerProcessing(guildId);
        return new EnqueueReceipt(guildId, items, depth);
    }

    /**
     * Clears the queue and stops the current item. The player is kept.
     */
    public void stop(String guildId) {
        PlaybackState state = states.get(guildId);
        if (state == null) {
            return;
        }
        AudioPlayer player;
        int cleared;
        state.lock.lock();
        try {
            cleared = state.queue.size();
            state.queue.clear();
            player = state.player;
        } finally {
            state.lock.unlock();
        }
        if (player != null) {
            player.stop();
        }
        LOG.info("Playback stopped for guild {} ({} queued item(s) cleared)", guildId, cleared);
    }

    /**
     * Stops playback and discards every piece of per-guild state.
     */
    public void cleanup(String guildId) {
        PlaybackState state = states.remove(guildId);
        if (state == null) {
            return;
        }
        state.lock.lock();
        try {
            state.queue.clear();
            if (state.player != null) {
                state.player.removeListener(state.playerListener);
                state.player.stop();
            }
            unsubscribe(state);
            state.player = null;
            state.playerListener = null;
            state.currentConnection = null;
            state.recentAudio.clear();
        } finally {
            state.lock.unlock();
        }
        LOG.info("Playback state discarded for guild {}", guildId);
    }

    @PreDestroy
    public void cleanupAll() {
        for (String guildId : new ArrayList<>(states.keySet())) {
            try {
                cleanup(guildId);
            } catch (RuntimeException e) {
                LOG.warn("Playback cleanup failed for guild {}: {}", guildId, e.toString());
            }
        }
    }

    /** Items waiting (not including the one playing), in play order. */
    public List<QueueItem> queueSnapshot(String guildId) {
        PlaybackState state = states.get(guildId);
        if (state == null) {
            return List.of();
        }
        state.lock.lock();
        try {
            return List.copyOf(state.queue);
        } finally {
            state.lock.unlock();
        }
    }

    public boolean isProcessing(String guildId) {
        PlaybackState state = states.get(guildId);
        if (state == null) {
            return false;
        }
        state.lock.lock();
        try {
            return state.processing;
        } finally {
            state.lock.unlock();
        }
    }

    /** Most recent audio handed to the player, oldest first. */
    public List<RecentAudio> recentAudio(String guildId) {
        PlaybackState state = states.get(guildId);
        return state == null ? List.of() : state.recentAudio.snapshot();
    }

    /**
     * Resumes deferred queues once the supervisor settles on a connection.
     */
    @EventListener
    public void onSessionStateChanged(VoiceSessionStateChangedEvent event) {
        if (event.to() == VoiceState.READY && states.containsKey(event.guildId())) {
            triggerProcessing(event.guildId());
        }
    }

    private PlaybackState stateFor(String guildId) {
        return states.computeIfAbsent(guildId, id -> new PlaybackState(id, props.getRecentAudioMaxItems()));
    }

    private void triggerProcessing(String guildId) {
        playbackExecutor.execute(() -> processNext(guildId));
    }

    /** Caller must hold the state lock. */
    private void ensurePlayer(PlaybackState state) {
        if (state.player != null) {
            return;
        }
        AudioPlayer player = transport.createPlayer(state.guildId);
        PlayerListener listener = new PlayerListener() {
            @Override
            public void onStatusChanged(PlayerStatus oldStatus, PlayerStatus newStatus) {
                if (newStatus == PlayerStatus.IDLE) {
                    triggerProcessing(state.guildId);
                }
            }

            @Override
            public void onError(AudioResource resource, Throwable error) {
                LOG.error("Audio player error in guild {} while playing {}: {}",
                        state.guildId, resource == null ? "?" : resource.name(), String.valueOf(error));
                triggerProcessing(state.guildId);
            }
        };
        player.addListener(listener);
        state.player = player;
        state.playerListener = listener;
        LOG.debug("Created audio player for guild {}", state.guildId);
    }

    /**
     * Routes the player to {@code connection}, replacing any subscription to another connection.
     * Caller must hold the state lock.
     */
    private void bind(PlaybackState state, VoiceConnection connection) {
        if (state.subscription != null && state.subscription.connection() == connection) {
            return;
        }
        unsubscribe(state);
        AudioSubscription subscription = connection.subscribe(state.player);
        if (subscription == null) {
            LOG.warn("Could not subscribe audio player to voice connection in guild {}", state.guildId);
            return;
        }
        state.subscription = subscription;
        LOG.info("Audio player subscribed to channel {} in guild {}",
                connection.channel().channelId(), state.guildId);
    }

    private static void unsubscribe(PlaybackState state) {
        AudioSubscription old = state.subscription;
        state.subscription = null;
        if (old == null) {
            return;
        }
        try {
            old.unsubscribe();
        } catch (RuntimeException e) {
            LOG.warn("Unsubscribing audio player failed in guild {}: {}", state.guildId, e.toString());
        }
    }

    /** Caller must hold the state lock. */
    private VoiceConnection resolveConnection(PlaybackState state) {
        if (supervisor.isReady(state.guildId)) {
            VoiceConnection current = supervisor.getConnection(state.guildId).orElse(null);
            if (current != null && !current.isDestroyed()) {
                return current;
            }
        }
        VoiceConnection recorded = state.currentConnection;
        if (recorded != null && !recorded.isDestroyed()) {
            return recorded;
        }
        return null;
    }

    void processNext(String guildId) {
        PlaybackState state = states.get(guildId);
        if (state == null) {
            return;
        }
        QueueItem item;
        AudioPlayer player;
        state.lock.lock();
        try {
            if (state.processing || state.queue.isEmpty()) {
                return;
            }
            if (state.player == null || state.player.status() != PlayerStatus.IDLE) {
                return;
            }
            VoiceConnection connection = resolveConnection(state);
            if (connection == null) {
                VoiceState voiceState = supervisor.getState(guildId);
                if (voiceState.isTransitioning()) {
                    LOG.debug("No connection yet for guild {} ({}); keeping {} item(s)",
                            guildId, voiceState, state.queue.size());
                    return;
                }
                int dropped = state.queue.size();
                state.queue.clear();
                metrics.recordDropped(dropped);
                LOG.warn("No usable voice connection for guild {}; dropped {} queued item(s)", guildId, dropped);
                return;
            }
            bind(state, connection);
            state.processing = true;
            item = state.queue.poll();
            player = state.player;
        } finally {
            state.lock.unlock();
        }

        try (CloseableThreadContext.Instance ctc = CloseableThreadContext.put("guildId", guildId)) {
            play(state, player, item);
        } finally {
            boolean more;
            state.lock.lock();
            try {
                state.processing = false;
                more = !state.queue.isEmpty();
            } finally {
                state.lock.unlock();
            }
            if (more && states.get(guildId) == state) {
                triggerProcessing(guildId);
            }
        }
    }

    private void play(PlaybackState state, AudioPlayer player, QueueItem item) {
        String outcome = "played";
        String reason = null;
        Throwable cause = null;
        try {
            String name = itemName(item);
            byte[] data = loadBytes(item);
            state.recentAudio.add(new RecentAudio(name, data, clock.instant()));
            AudioResource resource = resources.create(name, data);
            startAndAwait(player, resource);
            LOG.debug("Playing item #{} ({})", item.sequenceId(), item.kind());
        } catch (SynthesisException e) {
            outcome = "synthesis_failed";
            reason = e.getMessage();
            cause = e;
        } catch (ResourceBuildException e) {
            outcome = "resource_failed";
            reason = e.getMessage();
            cause = e;
        } catch (TimeoutException e) {
            outcome = "start_timeout";
            reason = "Playback did not start within " + props.getPlayStartTimeoutMs() + "ms";
            cause = e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = "interrupted";
            reason = "Interrupted while starting playback";
            cause = e;
        } catch (RuntimeException e) {
            outcome = "error";
            reason = e.toString();
            cause = e;
        }
        metrics.recordItem(item.metricKind(), outcome);
        if (cause != null) {
            LOG.error("Dropped item #{} ({}) in guild {}: {}", item.sequenceId(), item.kind(), state.guildId, reason);
            publisher.publishEvent(new PlaybackItemFailedEvent(state.guildId, item.sequenceId(),
                    item.metricKind(), reason, cause, clock.instant()));
        }
    }

    private byte[] loadBytes(QueueItem item) {
        if (item.kind() == QueueItem.Kind.SOUND) {
            try {
                return item.sound().readBytes();
            } catch (IOException e) {
                throw new ResourceBuildException(item.sound().fileName(), "cannot read file: " + e.getMessage());
            }
        }
        long start = System.nanoTime();
        try {
            return synthesizer.synthesize(item.text());
        } finally {
            metrics.recordSynthesisLatency(System.nanoTime() - start);
        }
    }

    private static String itemName(QueueItem item) {
        return item.kind() == QueueItem.Kind.SOUND
                ? "sound-" + item.sequenceId() + "-" + item.sound().fileName()
                : "tts-" + item.sequenceId() + ".mp3";
    }

    /**
     * Plays the resource and waits until the player reports PLAYING.
     */
    private void startAndAwait(AudioPlayer player, AudioResource resource)
            throws TimeoutException, InterruptedException {
        CompletableFuture<Void> started = new CompletableFuture<>();
        PlayerListener watcher = new PlayerListener() {
            @Override
            public void onStatusChanged(PlayerStatus oldStatus, PlayerStatus newStatus) {
                if (newStatus == PlayerStatus.PLAYING) {
                    started.complete(null);
                }
            }

            @Override
            public void onError(AudioResource failed, Throwable error) {
                started.completeExceptionally(error);
            }
        };
        player.addListener(watcher);
        try {
            player.play(resource);
            if (player.status() == PlayerStatus.PLAYING) {
                started.complete(null);
            }
            started.get(props.getPlayStartTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new ResourceBuildException(resource.name(), "player rejected resource: " + e.getCause());
        } finally {
            player.removeListener(watcher);
        }
    }
}
