package com.phillippitts.voicecompanion.service.follow;

import com.phillippitts.voicecompanion.config.properties.FollowProperties;
import com.phillippitts.voicecompanion.exception.RetriesExhaustedException;
import com.phillippitts.voicecompanion.service.settings.GuildSettingsStore;
import com.phillippitts.voicecompanion.service.voice.ConnectionSupervisor;
import com.phillippitts.voicecompanion.service.voice.transport.VoiceChannel;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Follows the owner between voice channels.
 *
 * <p>Registers with the {@link PresenceEventSource} on start, keeps only the owner's updates and
 * debounces them per guild. A burst is judged by its first "before" and last "after" channel, so a
 * quick hop through an intermediate channel results in a single move to where the owner ended up.
 * Decisions run on the voice executor; failures are logged, never propagated.
 *
 * <p>Leaving is suppressed while persistent mode is enabled for the guild.
 */
@Service
public class FollowCoordinator implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(FollowCoordinator.class);

    private final PresenceEventSource source;
    private final ConnectionSupervisor supervisor;
    private final GuildSettingsStore settings;
    private final FollowProperties props;
    private final Executor voiceExecutor;
    private final KeyedDebouncer<VoicePresenceUpdate> debouncer;
    private final Consumer<VoicePresenceUpdate> listener = this::onPresenceUpdate;

    private volatile boolean running;

    public FollowCoordinator(PresenceEventSource source,
                             ConnectionSupervisor supervisor,
                             GuildSettingsStore settings,
                             FollowProperties props,
                             @Qualifier("voiceExecutor") Executor voiceExecutor,
                             @Qualifier("voiceTaskScheduler") TaskScheduler scheduler) {
        this.source = source;
        this.supervisor = supervisor;
        this.settings = settings;
        this.props = props;
        this.voiceExecutor = voiceExecutor;
        this.debouncer = new KeyedDebouncer<>(scheduler, Duration.ofMillis(props.getDebounceDelayMs()),
                VoicePresenceUpdate::coalesce, (guildId, update) -> dispatch(update));
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        source.addListener(listener);
        running = true;
        LOG.info("FollowCoordinator started for owner {} (debounce {}ms)", props.getOwnerId(),
                props.getDebounceDelayMs());
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        source.removeListener(listener);
        int cancelled = debouncer.cancelAll();
        running = false;
        LOG.info("FollowCoordinator stopped ({} pending decision(s) cancelled)", cancelled);
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    void onPresenceUpdate(VoicePresenceUpdate update) {
        if (!props.isOwner(update.userId())) {
            return;
        }
        debouncer.submit(update.guildId(), update);
    }

    private void dispatch(VoicePresenceUpdate update) {
        voiceExecutor.execute(() -> decide(update));
    }

    void decide(VoicePresenceUpdate update) {
        String guildId = update.guildId();
        FollowAction action = FollowAction.classify(update.beforeChannelId(), update.afterChannelId());
        try (CloseableThreadContext.Instance ctc = CloseableThreadContext.put("guildId", guildId)) {
            switch (action) {
                case JOIN -> {
                    LOG.info("Owner joined channel {}; following", update.afterChannelId());
                    supervisor.join(new VoiceChannel(guildId, update.afterChannelId()));
                }
                case MOVE -> {
                    LOG.info("Owner moved {} -> {}; following", update.beforeChannelId(), update.afterChannelId());
                    supervisor.move(new VoiceChannel(guildId, update.afterChannelId()));
                }
                case LEAVE -> {
                    if (settings.isPersistentMode(guildId)) {
                        LOG.info("Owner left voice; persistent mode enabled, staying connected");
                        return;
                    }
                    LOG.info("Owner left voice; disconnecting");
                    supervisor.leave(guildId);
                }
                case IGNORE -> LOG.debug("Owner voice update without channel change");
            }
        } catch (RetriesExhaustedException e) {
            LOG.error("Failed to follow owner in guild {}: {}", guildId, e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Error processing owner voice update in guild {}", guildId, e);
        }
    }

    int pendingDecisions() {
        return debouncer.pendingCount();
    }
}
