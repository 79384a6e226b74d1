package com.phillippitts.voicecompanion.service.follow;

import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.function.BiConsumer;
import java.util.function.BinaryOperator;

/**
 * Per-key trailing-edge debounce.
 *
 * <p>Each submit cancels the key's pending timer and starts a new one. Values submitted during a
 * burst are folded with {@code merge(accumulated, next)}; the action receives the folded value
 * once the key has been quiet for {@code delay}. The action runs on the scheduler thread.
 *
 * @param <T> value type
 */
public final class KeyedDebouncer<T> {

    private final TaskScheduler scheduler;
    private final Duration delay;
    private final BinaryOperator<T> merge;
    private final BiConsumer<String, T> action;

    private final Map<String, Pending<T>> pending = new HashMap<>();

    public KeyedDebouncer(TaskScheduler scheduler, Duration delay,
                          BinaryOperator<T> merge, BiConsumer<String, T> action) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.delay = Objects.requireNonNull(delay, "delay");
        this.merge = Objects.requireNonNull(merge, "merge");
        this.action = Objects.requireNonNull(action, "action");
    }

    /**
     * Keeps only the latest value of a burst.
     */
    public static <T> BinaryOperator<T> keepLatest() {
        return (previous, next) -> next;
    }

    public synchronized void submit(String key, T value) {
        Pending<T> previous = pending.get(key);
        T merged = value;
        if (previous != null) {
            previous.future.cancel(false);
            merged = merge.apply(previous.value, value);
        }
        Pending<T> next = new Pending<>(merged);
        pending.put(key, next);
        next.future = scheduler.schedule(() -> fire(key, next), Instant.now().plus(delay));
    }

    /**
     * Cancels every pending timer.
     *
     * @return number of timers cancelled
     */
    public synchronized int cancelAll() {
        int count = pending.size();
        pending.values().forEach(p -> {
            if (p.future != null) {
                p.future.cancel(false);
            }
        });
        pending.clear();
        return count;
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    private void fire(String key, Pending<T> expected) {
        synchronized (this) {
            if (pending.get(key) != expected) {
                return;
            }
            pending.remove(key);
        }
        action.accept(key, expected.value);
    }

    private static final class Pending<T> {
        private final T value;
        private ScheduledFuture<?> future;

        Pending(T value) {
            this.value = value;
        }
    }
}
