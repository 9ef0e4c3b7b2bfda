package com.phillippitts.streamscribe.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Sizing for the two executors the engine runs on.
 *
 * <ul>
 *   <li>{@code threadpool.session.*} - shared pool behind every per-session worker. Each session
 *       occupies at most one thread at a time, so the max pool size bounds how many sessions can
 *       be transcribing simultaneously.</li>
 *   <li>{@code threadpool.archive.*} - background pool for object store writes after a session ends.</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "threadpool")
@Validated
public class ThreadPoolProperties {

    @Valid
    private PoolProperties session = new PoolProperties(8, 32, 200, "session-");

    @Valid
    private PoolProperties archive = new PoolProperties(1, 2, 100, "archive-");

    public PoolProperties getSession() {
        return session;
    }

    public void setSession(PoolProperties session) {
        this.session = session;
    }

    public PoolProperties getArchive() {
        return archive;
    }

    public void setArchive(PoolProperties archive) {
        this.archive = archive;
    }

    /**
     * Settings for one {@code ThreadPoolTaskExecutor}.
     */
    public static class PoolProperties {

        @Positive
        private int corePoolSize;

        @Positive
        private int maxPoolSize;

        @PositiveOrZero
        private int queueCapacity;

        @Positive
        private int keepAliveSeconds = 60;

        @NotBlank
        private String threadNamePrefix;

        public PoolProperties() {
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
}
