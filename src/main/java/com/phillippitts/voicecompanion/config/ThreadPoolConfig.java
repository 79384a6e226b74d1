package com.phillippitts.voicecompanion.config;

import com.phillippitts.voicecompanion.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the executors and timers behind voice lifecycle and playback work.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the bounded pool that runs join/move/leave decisions off the timer and request threads.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.voice.*} properties:
     * <ul>
     *   <li>Core pool: default 4 - typical number of guilds changing state at once</li>
     *   <li>Max pool: default 16 - connect attempts blocked on ready signals</li>
     *   <li>Queue: default 100 tasks - prevents unbounded memory growth</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}
     * When the pool and queue are full, the caller thread executes the task,
     * providing backpressure instead of failing fast.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the submitting thread to
     * the worker thread to preserve request/guild correlation IDs in async logs.
     *
     * @return Configured executor for voice lifecycle work
     */
    @Bean(name = "voiceExecutor")
    public Executor voiceExecutor() {
        return boundedExecutor(threadPoolProperties.getVoice());
    }

    /**
     * Creates the pool that runs {@code transport.connect} calls for connect attempts.
     *
     * <p>Attempts block a lifecycle thread until their connect task completes, so the connect
     * task must never wait behind that thread in a shared queue. This pool has no queue and grows to
     * {@code threadpool.connect.max-pool-size}; past that a connect is rejected with
     * {@link ThreadPoolExecutor.AbortPolicy} and the attempt fails and is retried with backoff.
     * It never falls back to the caller thread, which would lose the join timeout.
     *
     * @return Configured executor for transport connect calls
     */
    @Bean(name = "voiceConnectExecutor")
    public Executor voiceConnectExecutor() {
        return boundedExecutor(threadPoolProperties.getConnect(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Creates the pool that drains per-guild playback queues.
     *
     * <p>Each guild runs at most one processing task at a time, so this pool bounds how many
     * guilds can synthesize and start playback concurrently.
     *
     * @return Configured executor for playback processing
     */
    @Bean(name = "playbackExecutor")
    public Executor playbackExecutor() {
        return boundedExecutor(threadPoolProperties.getPlayback());
    }

    /**
     * Scheduler for debounce timers, disconnect-grace checks and {@code @Scheduled} summaries.
     */
    @Bean(name = "voiceTaskScheduler")
    public ThreadPoolTaskScheduler voiceTaskScheduler() {
        ThreadPoolProperties.SchedulerProperties props = threadPoolProperties.getScheduler();
        ThreadPoolTaskScheduler scheduler = new MdcPropagatingTaskScheduler(mdcPropagatingDecorator());
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    private static ThreadPoolTaskExecutor boundedExecutor(ThreadPoolProperties.PoolProperties props) {
        return boundedExecutor(props, new ThreadPoolExecutor.CallerRunsPolicy());
    }

    private static ThreadPoolTaskExecutor boundedExecutor(ThreadPoolProperties.PoolProperties props,
                                                          RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
