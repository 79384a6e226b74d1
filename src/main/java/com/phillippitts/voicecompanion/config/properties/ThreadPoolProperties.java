package com.phillippitts.voicecompanion.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>Sizes the voice lifecycle executor, the transport connect executor, the playback executor and
 * the timer scheduler used for debounce and disconnect-grace checks. Lifecycle work blocks on
 * transport signals, so that pool is wider than the playback pool, which only ever runs one task
 * per guild at a time. The connect pool has no queue: it hands each connect to a thread or rejects it.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private PoolProperties voice = new PoolProperties(4, 16, 100, "voice-pool-");
    private PoolProperties connect = new PoolProperties(2, 32, 0, "voice-connect-");
    private PoolProperties playback = new PoolProperties(2, 8, 200, "playback-pool-");
    private SchedulerProperties scheduler = new SchedulerProperties();

    public PoolProperties getVoice() {
        return voice;
    }

    public void setVoice(PoolProperties voice) {
        this.voice = voice;
    }

    public PoolProperties getConnect() {
        return connect;
    }

    public void setConnect(PoolProperties connect) {
        this.connect = connect;
    }

    public PoolProperties getPlayback() {
        return playback;
    }

    public void setPlayback(PoolProperties playback) {
        this.playback = playback;
    }

    public SchedulerProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerProperties scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Bounded executor pool configuration.
     */
    public static class PoolProperties {
        private int corePoolSize;
        private int maxPoolSize;
        private int queueCapacity;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        public PoolProperties() {
            this(2, 4, 10, "pool-");
        }

        PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Timer scheduler configuration.
     */
    public static class SchedulerProperties {
        private int poolSize = 2;
        private String threadNamePrefix = "voice-timer-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
