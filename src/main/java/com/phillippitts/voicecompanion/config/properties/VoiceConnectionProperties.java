package com.phillippitts.voicecompanion.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Timing and retry bounds for the per-guild voice connection lifecycle.
 *
 * <p>Every blocking step of join/move is bounded by one of these values:
 * <ul>
 *   <li>{@code join-timeout-ms} - transport accepting the connect request</li>
 *   <li>{@code ready-timeout-ms} - connection signalling ready</li>
 *   <li>{@code backoff-base-ms}/{@code backoff-max-ms} - sleep between attempts</li>
 *   <li>{@code disconnect-grace-ms} - wait for recovery after a disconnect signal</li>
 * </ul>
 *
 * @since 1.0
 */
@Validated
@ConfigurationProperties(prefix = "voice.connection")
public class VoiceConnectionProperties {

    @Positive
    private final long joinTimeoutMs;

    @Positive
    private final long readyTimeoutMs;

    /** Retries after the first attempt; 3 means up to 4 connect attempts. */
    @Min(0)
    @Max(10)
    private final int maxRetries;

    @Positive
    private final long backoffBaseMs;

    @Positive
    private final long backoffMaxMs;

    @Positive
    private final long disconnectGraceMs;

    @ConstructorBinding
    public VoiceConnectionProperties(Long joinTimeoutMs,
                                     Long readyTimeoutMs,
                                     Integer maxRetries,
                                     Long backoffBaseMs,
                                     Long backoffMaxMs,
                                     Long disconnectGraceMs) {
        this.joinTimeoutMs = joinTimeoutMs == null ? 10_000L : joinTimeoutMs;
        this.readyTimeoutMs = readyTimeoutMs == null ? 20_000L : readyTimeoutMs;
        this.maxRetries = maxRetries == null ? 3 : maxRetries;
        this.backoffBaseMs = backoffBaseMs == null ? 1_000L : backoffBaseMs;
        this.backoffMaxMs = backoffMaxMs == null ? 10_000L : backoffMaxMs;
        this.disconnectGraceMs = disconnectGraceMs == null ? 5_000L : disconnectGraceMs;
    }

    public long getJoinTimeoutMs() {
        return joinTimeoutMs;
    }

    public long getReadyTimeoutMs() {
        return readyTimeoutMs;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public long getBackoffBaseMs() {
        return backoffBaseMs;
    }

    public long getBackoffMaxMs() {
        return backoffMaxMs;
    }

    public long getDisconnectGraceMs() {
        return disconnectGraceMs;
    }

    public Duration joinTimeout() {
        return Duration.ofMillis(joinTimeoutMs);
    }

    public Duration readyTimeout() {
        return Duration.ofMillis(readyTimeoutMs);
    }
}
