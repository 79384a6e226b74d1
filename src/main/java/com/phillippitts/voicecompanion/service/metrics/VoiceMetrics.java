package com.phillippitts.voicecompanion.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for voice sessions and playback.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Connect attempts by outcome (ready, timeout, rejected, exhausted, superseded)</li>
 *   <li>Retries and connections lost after the disconnect grace window</li>
 *   <li>Playback items by kind and outcome, plus queues dropped with no connection</li>
 *   <li>Speech synthesis latency</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class VoiceMetrics {

    private static final String CONNECTION_PREFIX = "voice.connection";
    private static final String PLAYBACK_PREFIX = "voice.playback";

    private final MeterRegistry registry;

    public VoiceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts one finished connect attempt.
     *
     * @param outcome ready, timeout, rejected, exhausted or superseded
     */
    public void recordConnectAttempt(String outcome) {
        Counter.builder(CONNECTION_PREFIX + ".attempts")
                .description("Voice connect attempts by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementRetries() {
        Counter.builder(CONNECTION_PREFIX + ".retries")
                .description("Voice connect retries after backoff")
                .register(registry)
                .increment();
    }

    public void incrementConnectionLost() {
        Counter.builder(CONNECTION_PREFIX + ".lost")
                .description("Connections torn down after the disconnect grace window")
                .register(registry)
                .increment();
    }

    /**
     * Counts one processed queue item.
     *
     * @param kind speech or sound
     * @param outcome played, synthesis_failed, resource_failed, start_timeout or error
     */
    public void recordItem(String kind, String outcome) {
        Counter.builder(PLAYBACK_PREFIX + ".items")
                .description("Playback items by kind and outcome")
                .tag("kind", kind)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Counts items discarded because no usable connection existed.
     */
    public void recordDropped(int items) {
        Counter.builder(PLAYBACK_PREFIX + ".dropped")
                .description("Queued items dropped with no usable connection")
                .register(registry)
                .increment(items);
    }

    public void recordSynthesisLatency(long durationNanos) {
        Timer.builder(PLAYBACK_PREFIX + ".synthesis")
                .description("Time taken to synthesize speech")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
