package com.phillippitts.voicecompanion.service.voice;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffPolicyTest {

    @Test
    void doublesPerRetryWithoutJitter() {
        BackoffPolicy policy = new BackoffPolicy(1_000, 10_000, () -> 0.0, millis -> { });

        assertThat(policy.delayMs(0)).isEqualTo(1_000);
        assertThat(policy.delayMs(1)).isEqualTo(2_000);
        assertThat(policy.delayMs(2)).isEqualTo(4_000);
        assertThat(policy.delayMs(3)).isEqualTo(8_000);
    }

    @Test
    void capsAtMaximumBeforeJitter() {
        BackoffPolicy policy = new BackoffPolicy(1_000, 10_000, () -> 0.0, millis -> { });

        assertThat(policy.delayMs(4)).isEqualTo(10_000);
        assertThat(policy.delayMs(40)).isEqualTo(10_000);
    }

    @Test
    void jitterAddsAtMostThirtyPercent() {
        BackoffPolicy high = new BackoffPolicy(1_000, 10_000, () -> 0.999_999, millis -> { });

        assertThat(high.delayMs(0)).isBetween(1_000L, 1_300L);
        assertThat(high.delayMs(10)).isBetween(10_000L, 13_000L);
    }

    @Test
    void randomDelaysStayWithinBounds() {
        BackoffPolicy policy = new BackoffPolicy(500, 4_000, Math::random, millis -> { });

        for (int retries = 0; retries < 6; retries++) {
            long floor = Math.min(500L << retries, 4_000L);
            long delay = policy.delayMs(retries);
            assertThat(delay).isBetween(floor, (long) (floor * 1.3));
        }
    }

    @Test
    void pauseSleepsForComputedDelay() throws InterruptedException {
        List<Long> slept = new ArrayList<>();
        BackoffPolicy policy = new BackoffPolicy(100, 1_000, () -> 0.0, slept::add);

        long delay = policy.pause(1);

        assertThat(delay).isEqualTo(200);
        assertThat(slept).containsExactly(200L);
    }

    @Test
    void rejectsInvalidBounds() {
        assertThatThrownBy(() -> new BackoffPolicy(0, 100, () -> 0.0, millis -> { }))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffPolicy(500, 100, () -> 0.0, millis -> { }))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
