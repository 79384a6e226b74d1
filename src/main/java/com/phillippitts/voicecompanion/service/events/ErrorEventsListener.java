package com.phillippitts.voicecompanion.service.events;

import com.phillippitts.voicecompanion.service.playback.event.PlaybackItemFailedEvent;
import com.phillippitts.voicecompanion.service.voice.event.VoiceConnectionLostEvent;
import com.phillippitts.voicecompanion.service.voice.event.VoiceJoinFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Operator-facing log lines for voice and playback failures.
 *
 * <p>A flapping guild can raise the same event many times a second, so each key
 * (event type plus guild, and item kind for playback) logs at most once per {@link #THROTTLE}.
 * Swallowed occurrences are counted and reported with the next line that gets through.
 */
@Component
class ErrorEventsListener {

    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);
    static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Clock clock;
    private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();

    @Autowired
    ErrorEventsListener() {
        this(Clock.systemUTC());
    }

    ErrorEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onJoinFailed(VoiceJoinFailedEvent e) {
        int suppressed = admit("join-failed:" + e.guildId());
        if (suppressed >= 0) {
            LOG.warn("Voice join failed: guild={}, channel={}, attempts={}, suppressed={}. "
                            + "Check the bot's permissions and the voice gateway.",
                    e.guildId(), e.channelId(), e.attempts(), suppressed);
        }
    }

    @EventListener
    void onConnectionLost(VoiceConnectionLostEvent e) {
        int suppressed = admit("connection-lost:" + e.guildId());
        if (suppressed >= 0) {
            LOG.warn("Voice connection lost: guild={}, channel={}, reason={}, suppressed={}",
                    e.guildId(), e.channelId(), e.reason(), suppressed);
        }
    }

    @EventListener
    void onPlaybackItemFailed(PlaybackItemFailedEvent e) {
        int suppressed = admit("playback:" + e.guildId() + ':' + e.kind());
        if (suppressed >= 0) {
            LOG.warn("Playback item dropped: guild={}, kind={}, seq={}, reason={}, suppressed={}",
                    e.guildId(), e.kind(), e.sequenceId(), e.reason(), suppressed);
        }
    }

    boolean shouldLog(String key) {
        return admit(key) >= 0;
    }

    /**
     * Returns how many occurrences of {@code key} were swallowed since its last logged line,
     * or -1 when this occurrence falls inside the throttle window.
     */
    int admit(String key) {
        Instant now = clock.instant();
        AtomicInteger result = new AtomicInteger(-1);
        windows.compute(key, (k, w) -> {
            if (w == null || Duration.between(w.openedAt(), now).compareTo(THROTTLE) >= 0) {
                result.set(w == null ? 0 : w.suppressed());
                return new Window(now, 0);
            }
            return new Window(w.openedAt(), w.suppressed() + 1);
        });
        return result.get();
    }

    private record Window(Instant openedAt, int suppressed) {
    }
}
