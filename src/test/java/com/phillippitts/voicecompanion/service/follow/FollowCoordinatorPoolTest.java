package com.phillippitts.voicecompanion.service.follow;

import com.phillippitts.voicecompanion.config.ThreadPoolConfig;
import com.phillippitts.voicecompanion.config.properties.FollowProperties;
import com.phillippitts.voicecompanion.config.properties.ThreadPoolProperties;
import com.phillippitts.voicecompanion.config.properties.VoiceConnectionProperties;
import com.phillippitts.voicecompanion.service.metrics.VoiceMetrics;
import com.phillippitts.voicecompanion.service.settings.JsonFileGuildSettingsStore;
import com.phillippitts.voicecompanion.service.voice.BackoffPolicy;
import com.phillippitts.voicecompanion.service.voice.ConnectionSupervisor;
import com.phillippitts.voicecompanion.service.voice.VoiceState;
import com.phillippitts.voicecompanion.testutil.EventCapturingPublisher;
import com.phillippitts.voicecompanion.testutil.FakeVoiceTransport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Follow decisions and connect attempts on the production executors, with the lifecycle pool
 * squeezed to a single thread.
 */
class FollowCoordinatorPoolTest {

    private static final String OWNER = "100000000000000001";

    @TempDir
    Path dataDir;

    private FakeVoiceTransport transport;
    private ThreadPoolTaskExecutor voiceExecutor;
    private ThreadPoolTaskExecutor connectExecutor;
    private ThreadPoolTaskScheduler scheduler;
    private ConnectionSupervisor supervisor;
    private InProcessPresenceBus bus;
    private FollowCoordinator coordinator;

    @BeforeEach
    void setUp() {
        ThreadPoolProperties pools = new ThreadPoolProperties();
        pools.getVoice().setCorePoolSize(1);
        pools.getVoice().setMaxPoolSize(1);
        ThreadPoolConfig config = new ThreadPoolConfig(pools);
        voiceExecutor = (ThreadPoolTaskExecutor) config.voiceExecutor();
        connectExecutor = (ThreadPoolTaskExecutor) config.voiceConnectExecutor();
        scheduler = config.voiceTaskScheduler();

        transport = new FakeVoiceTransport();
        supervisor = new ConnectionSupervisor(transport,
                new VoiceConnectionProperties(300L, 300L, 1, 10L, 20L, 5_000L),
                new BackoffPolicy(10, 20, () -> 0.0, millis -> { }),
                connectExecutor, scheduler, new EventCapturingPublisher(),
                new VoiceMetrics(new SimpleMeterRegistry()));
        bus = new InProcessPresenceBus();
        coordinator = new FollowCoordinator(bus, supervisor, new JsonFileGuildSettingsStore(dataDir),
                new FollowProperties(OWNER, 30L, 30L), voiceExecutor, scheduler);
        coordinator.start();
    }

    @AfterEach
    void tearDown() {
        coordinator.stop();
        supervisor.cleanupAll();
        voiceExecutor.shutdown();
        connectExecutor.shutdown();
        scheduler.shutdown();
    }

    @Test
    void followDecisionDoesNotStarveItsOwnConnect() {
        bus.publish(new VoicePresenceUpdate("g1", OWNER, null, "c1"));

        await().atMost(Duration.ofSeconds(2)).until(() -> supervisor.isReady("g1"));
        assertThat(supervisor.getChannelId("g1")).contains("c1");
        assertThat(transport.connectCalls()).isEqualTo(1);
    }

    @Test
    void decisionsForSeveralGuildsAllReachReady() {
        for (String guild : new String[]{"g1", "g2", "g3"}) {
            bus.publish(new VoicePresenceUpdate(guild, OWNER, null, "c-" + guild));
        }

        await().atMost(Duration.ofSeconds(3)).untilAsserted(() -> {
            assertThat(supervisor.getState("g1")).isEqualTo(VoiceState.READY);
            assertThat(supervisor.getState("g2")).isEqualTo(VoiceState.READY);
            assertThat(supervisor.getState("g3")).isEqualTo(VoiceState.READY);
        });
        assertThat(transport.connectCalls()).isEqualTo(3);
    }
}
