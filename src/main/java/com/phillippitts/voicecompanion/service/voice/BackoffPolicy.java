package com.phillippitts.voicecompanion.service.voice;

import com.phillippitts.voicecompanion.config.properties.VoiceConnectionProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with multiplicative jitter between connect attempts.
 *
 * <p>{@code delay(n) = min(base * 2^n, max) * (1 + jitter)} with jitter drawn from {@code [0, 0.3)},
 * where {@code n} is the number of retries already made.
 */
@Component
public class BackoffPolicy {

    static final double MAX_JITTER = 0.3;

    private final long baseMs;
    private final long maxMs;
    private final DoubleSupplier unitRandom;
    private final Sleeper sleeper;

    @Autowired
    public BackoffPolicy(VoiceConnectionProperties props) {
        this(props.getBackoffBaseMs(), props.getBackoffMaxMs(),
                () -> ThreadLocalRandom.current().nextDouble(), Sleeper.THREAD);
    }

    public BackoffPolicy(long baseMs, long maxMs, DoubleSupplier unitRandom, Sleeper sleeper) {
        if (baseMs <= 0 || maxMs < baseMs) {
            throw new IllegalArgumentException("Invalid backoff bounds: base=" + baseMs + " max=" + maxMs);
        }
        this.baseMs = baseMs;
        this.maxMs = maxMs;
        this.unitRandom = Objects.requireNonNull(unitRandom, "unitRandom");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Computes the delay before the next attempt.
     *
     * @param retries retries made so far (0 for the first retry)
     * @return delay in milliseconds
     */
    public long delayMs(int retries) {
        int exponent = Math.max(0, Math.min(retries, 30));
        long raw = Math.min(baseMs << exponent, maxMs);
        double jitter = unitRandom.getAsDouble() * MAX_JITTER;
        return (long) (raw * (1.0 + jitter));
    }

    /**
     * Sleeps for {@link #delayMs(int)}.
     *
     * @return the delay slept
     */
    public long pause(int retries) throws InterruptedException {
        long delay = delayMs(retries);
        sleeper.sleep(delay);
        return delay;
    }
}
