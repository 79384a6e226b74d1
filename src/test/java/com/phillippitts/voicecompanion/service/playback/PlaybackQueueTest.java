package com.phillippitts.voicecompanion.service.playback;

import com.phillippitts.voicecompanion.config.properties.PlaybackProperties;
import com.phillippitts.voicecompanion.config.properties.VoiceConnectionProperties;
import com.phillippitts.voicecompanion.exception.EmptyInputException;
import com.phillippitts.voicecompanion.exception.RateLimitedException;
import com.phillippitts.voicecompanion.service.metrics.VoiceMetrics;
import com.phillippitts.voicecompanion.service.playback.event.PlaybackItemFailedEvent;
import com.phillippitts.voicecompanion.service.sound.SoundLibrary;
import com.phillippitts.voicecompanion.service.sound.SoundSource;
import com.phillippitts.voicecompanion.service.voice.BackoffPolicy;
import com.phillippitts.voicecompanion.service.voice.ConnectionSupervisor;
import com.phillippitts.voicecompanion.service.voice.VoiceState;
import com.phillippitts.voicecompanion.service.voice.event.VoiceSessionStateChangedEvent;
import com.phillippitts.voicecompanion.service.voice.transport.ConnectionStatus;
import com.phillippitts.voicecompanion.service.voice.transport.VoiceChannel;
import com.phillippitts.voicecompanion.service.voice.transport.VoiceConnection;
import com.phillippitts.voicecompanion.testutil.EventCapturingPublisher;
import com.phillippitts.voicecompanion.testutil.FakeAudioPlayer;
import com.phillippitts.voicecompanion.testutil.FakeSynthesizer;
import com.phillippitts.voicecompanion.testutil.FakeVoiceConnection;
import com.phillippitts.voicecompanion.testutil.FakeVoiceTransport;
import com.phillippitts.voicecompanion.testutil.MutableClock;
import com.phillippitts.voicecompanion.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class PlaybackQueueTest {

    private static final String GUILD = "g1";

    @TempDir
    Path soundsDir;

    private FakeVoiceTransport transport;
    private FakeSynthesizer synthesizer;
    private EventCapturingPublisher publisher;
    private SimpleMeterRegistry registry;
    private MutableClock clock;
    private ThreadPoolTaskScheduler scheduler;
    private ConnectionSupervisor supervisor;
    private SoundLibrary sounds;
    private PlaybackQueue queue;

    @BeforeEach
    void setUp() throws IOException {
        transport = new FakeVoiceTransport();
        synthesizer = new FakeSynthesizer();
        publisher = new EventCapturingPublisher();
        registry = new SimpleMeterRegistry();
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.initialize();

        VoiceConnectionProperties voiceProps = new VoiceConnectionProperties(1_000L, 2_000L, 0, 10L, 50L, 5_000L);
        supervisor = new ConnectionSupervisor(transport, voiceProps,
                new BackoffPolicy(10, 50, () -> 0.0, millis -> { }),
                new SyncExecutor(), scheduler, publisher, new VoiceMetrics(registry));

        Path hmph = soundsDir.resolve("hmph.wav");
        Files.write(hmph, wavBytes());
        sounds = key -> "hmph".equals(key) ? Optional.of(new SoundSource("hmph", hmph)) : Optional.empty();

        queue = newQueue(new PlaybackProperties(200L, 200, 500L, 10, soundsDir.toString()));
    }

    @AfterEach
    void tearDown() {
        queue.cleanupAll();
        supervisor.cleanupAll();
        scheduler.shutdown();
    }

    @Test
    void rejectsTextEmptyAfterSanitization() {
        VoiceConnection connection = supervisor.join(channel("c1"));

        assertThatThrownBy(() -> queue.enqueue(GUILD, "<@123> @everyone <#456>", connection))
                .isInstanceOf(EmptyInputException.class);

        assertThat(queue.queueSnapshot(GUILD)).isEmpty();
        assertThat(synthesizer.requests()).isEmpty();
    }

    @Test
    void rateLimitsRequestsWithinInterval() {
        VoiceConnection connection = supervisor.join(channel("c1"));
        queue.enqueue(GUILD, "hello", connection);

        clock.advance(Duration.ofMillis(50));
        assertThatThrownBy(() -> queue.enqueue(GUILD, "again", connection))
                .isInstanceOf(RateLimitedException.class)
                .satisfies(e -> assertThat(((RateLimitedException) e).getRetryAfterMs()).isEqualTo(150));

        clock.advance(Duration.ofMillis(150));
        assertThat(queue.enqueue(GUILD, "again", connection).items()).hasSize(1);
    }

    @Test
    void emptyRequestStillCountsTowardRateLimit() {
        VoiceConnection connection = supervisor.join(channel("c1"));

        assertThatThrownBy(() -> queue.enqueue(GUILD, "   ", connection))
                .isInstanceOf(EmptyInputException.class);
        assertThatThrownBy(() -> queue.enqueue(GUILD, "hello", connection))
                .isInstanceOf(RateLimitedException.class);
    }

    @Test
    void splitsSpeechAroundSoundTriggers() {
        VoiceConnection connection = supervisor.join(channel("c1"));

        EnqueueReceipt receipt = queue.enqueue(GUILD, "a hmph ok", connection);

        assertThat(receipt.items()).extracting(QueueItem::kind)
                .containsExactly(QueueItem.Kind.SPEECH, QueueItem.Kind.SOUND, QueueItem.Kind.SPEECH);
        assertThat(receipt.items()).extracting(QueueItem::text).containsExactly("a", "hmph", "ok");
        assertThat(receipt.items()).extracting(QueueItem::sequenceId).containsExactly(1L, 2L, 3L);

        FakeAudioPlayer player = transport.player(GUILD);
        assertThat(player.playedNames()).containsExactly("tts-1.mp3");
        player.finish();
        assertThat(player.playedNames()).containsExactly("tts-1.mp3", "sound-2-hmph.wav");
        player.finish();
        assertThat(player.playedNames()).containsExactly("tts-1.mp3", "sound-2-hmph.wav", "tts-3.mp3");
        assertThat(synthesizer.requests()).containsExactly("a", "ok");
    }

    @Test
    void playsOneItemAtATimeInEnqueueOrder() {
        VoiceConnection connection = supervisor.join(channel("c1"));
        queue.enqueue(GUILD, "first", connection);
        clock.advance(Duration.ofSeconds(1));
        queue.enqueue(GUILD, "second", connection);

        FakeAudioPlayer player = transport.player(GUILD);
        assertThat(player.played()).hasSize(1);
        assertThat(queue.queueSnapshot(GUILD)).extracting(QueueItem::text).containsExactly("second");
        assertThat(queue.isProcessing(GUILD)).isFalse();

        player.finish();

        assertThat(synthesizer.requests()).containsExactly("first", "second");
        assertThat(queue.queueSnapshot(GUILD)).isEmpty();
    }

    @Test
    void synthesisFailureSkipsToNextItem() {
        synthesizer.failFor("bad");
        VoiceConnection connection = supervisor.join(channel("c1"));

        queue.enqueue(GUILD, "bad hmph", connection);

        assertThat(transport.player(GUILD).playedNames()).containsExactly("sound-2-hmph.wav");
        assertThat(publisher.eventsOfType(PlaybackItemFailedEvent.class))
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.sequenceId()).isEqualTo(1L);
                    assertThat(e.kind()).isEqualTo("speech");
                });
        assertThat(registry.get("voice.playback.items")
                .tag("kind", "speech").tag("outcome", "synthesis_failed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void playerErrorSkipsToNextItem() {
        FakeAudioPlayer player = (FakeAudioPlayer) transport.createPlayer(GUILD);
        player.failNextPlay();
        VoiceConnection connection = supervisor.join(channel("c1"));

        queue.enqueue(GUILD, "one hmph", connection);

        assertThat(player.playedNames()).containsExactly("tts-1.mp3", "sound-2-hmph.wav");
        assertThat(registry.get("voice.playback.items")
                .tag("kind", "speech").tag("outcome", "resource_failed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void playbackThatNeverStartsIsReported() {
        queue = newQueue(new PlaybackProperties(200L, 200, 100L, 10, soundsDir.toString()));
        FakeAudioPlayer player = (FakeAudioPlayer) transport.createPlayer(GUILD);
        player.neverStart(true);
        VoiceConnection connection = supervisor.join(channel("c1"));

        queue.enqueue(GUILD, "slow", connection);

        assertThat(publisher.eventsOfType(PlaybackItemFailedEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.reason()).contains("did not start"));
        assertThat(player.listenerCount()).isEqualTo(1);
    }

    @Test
    void remainingItemsFollowTheSessionToNewChannel() {
        FakeVoiceConnection first = (FakeVoiceConnection) supervisor.join(channel("c1"));
        queue.enqueue(GUILD, "a hmph b", first);
        FakeAudioPlayer player = transport.player(GUILD);
        assertThat(first.activeSubscriptions()).isEqualTo(1);

        FakeVoiceConnection second = (FakeVoiceConnection) supervisor.move(channel("c2"));
        player.finish();

        assertThat(player.playedNames()).containsExactly("tts-1.mp3", "sound-2-hmph.wav");
        assertThat(first.activeSubscriptions()).isZero();
        assertThat(second.activeSubscriptions()).isEqualTo(1);

        player.finish();
        assertThat(player.played()).hasSize(3);
    }

    @Test
    void dropsQueueWhenSessionIsIdle() {
        VoiceConnection connection = supervisor.join(channel("c1"));
        queue.enqueue(GUILD, "a hmph b", connection);
        FakeAudioPlayer player = transport.player(GUILD);

        supervisor.leave(GUILD);
        player.finish();

        assertThat(player.played()).hasSize(1);
        assertThat(queue.queueSnapshot(GUILD)).isEmpty();
        assertThat(registry.get("voice.playback.dropped").counter().count()).isEqualTo(2.0);
    }

    @Test
    void keepsQueueWhileConnectingAndResumesWhenReady() throws Exception {
        publisher.forwardTo(e -> {
            if (e instanceof VoiceSessionStateChangedEvent change) {
                queue.onSessionStateChanged(change);
            }
        });
        VoiceConnection first = supervisor.join(channel("c1"));
        queue.enqueue(GUILD, "a hmph b", first);
        FakeAudioPlayer player = transport.player(GUILD);

        transport.startReady(false);
        CompletableFuture<VoiceConnection> move =
                CompletableFuture.supplyAsync(() -> supervisor.move(channel("c2")));
        await().atMost(Duration.ofSeconds(2)).until(() -> supervisor.getState(GUILD) == VoiceState.CONNECTING
                && transport.connections().size() == 2);

        player.finish();
        assertThat(player.played()).hasSize(1);
        assertThat(queue.queueSnapshot(GUILD)).hasSize(2);

        transport.lastConnection().signalReady();
        move.get(2, TimeUnit.SECONDS);

        await().atMost(Duration.ofSeconds(2)).until(() -> player.played().size() == 2);
        assertThat(transport.lastConnection().activeSubscriptions()).isEqualTo(1);
    }

    @Test
    void usesConnectionPassedByCallerWhenSupervisorHasNone() {
        FakeVoiceConnection external = new FakeVoiceConnection(channel("c9"), ConnectionStatus.READY);

        queue.enqueue(GUILD, "hello", external);

        assertThat(transport.player(GUILD).played()).hasSize(1);
        assertThat(external.activeSubscriptions()).isEqualTo(1);
    }

    @Test
    void stopClearsQueueAndStopsCurrentItem() {
        VoiceConnection connection = supervisor.join(channel("c1"));
        queue.enqueue(GUILD, "a hmph b", connection);
        FakeAudioPlayer player = transport.player(GUILD);

        queue.stop(GUILD);

        assertThat(queue.queueSnapshot(GUILD)).isEmpty();
        assertThat(player.stopCalls()).isEqualTo(1);
        assertThat(player.played()).hasSize(1);
    }

    @Test
    void cleanupDiscardsGuildState() {
        FakeVoiceConnection connection = (FakeVoiceConnection) supervisor.join(channel("c1"));
        queue.enqueue(GUILD, "a hmph b", connection);
        FakeAudioPlayer player = transport.player(GUILD);

        queue.cleanup(GUILD);

        assertThat(queue.queueSnapshot(GUILD)).isEmpty();
        assertThat(queue.recentAudio(GUILD)).isEmpty();
        assertThat(player.listenerCount()).isZero();
        assertThat(connection.activeSubscriptions()).isZero();
    }

    @Test
    void recentAudioKeepsNewestItems() {
        queue = newQueue(new PlaybackProperties(200L, 200, 500L, 2, soundsDir.toString()));
        VoiceConnection connection = supervisor.join(channel("c1"));
        queue.enqueue(GUILD, "a hmph b", connection);
        FakeAudioPlayer player = transport.player(GUILD);
        player.finish();
        player.finish();

        assertThat(queue.recentAudio(GUILD)).extracting(RecentAudio::name)
                .containsExactly("sound-2-hmph.wav", "tts-3.mp3");
    }

    private PlaybackQueue newQueue(PlaybackProperties props) {
        return new PlaybackQueue(supervisor, transport, synthesizer, new TextSanitizer(props.getMaxTextChars()),
                new TextSegmenter(sounds), new ProbingAudioResourceFactory(), props, new SyncExecutor(),
                publisher, new VoiceMetrics(registry), clock);
    }

    private static VoiceChannel channel(String channelId) {
        return new VoiceChannel(GUILD, channelId);
    }

    private static byte[] wavBytes() {
        byte[] header = "RIFF\0\0\0\0WAVEfmt ".getBytes(StandardCharsets.US_ASCII);
        byte[] out = new byte[header.length + 32];
        System.arraycopy(header, 0, out, 0, header.length);
        return out;
    }
}
