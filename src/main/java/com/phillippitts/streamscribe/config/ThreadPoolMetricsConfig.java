package com.phillippitts.streamscribe.config;

import com.phillippitts.streamscribe.service.ingest.SessionRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes session pool and registry gauges via Micrometer:
 * <ul>
 *   <li>session.pool.size / active / queued / completed</li>
 *   <li>sessions.active - sessions currently registered</li>
 * </ul>
 *
 * <p>Also logs a health summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> sessionExecutorProvider;
    private final SessionRegistry sessionRegistry;

    public ThreadPoolMetricsConfig(
            @Qualifier("sessionExecutor") ObjectProvider<ThreadPoolTaskExecutor> sessionExecutorProvider,
            SessionRegistry sessionRegistry) {
        this.sessionExecutorProvider = sessionExecutorProvider;
        this.sessionRegistry = sessionRegistry;
    }

    @Bean
    public MeterBinder sessionExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = sessionExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("session.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the session pool")
                    .register(registry);

            Gauge.builder("session.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Threads actively running session tasks")
                    .register(registry);

            Gauge.builder("session.pool.queued", executor, e -> e.getQueue().size())
                    .description("Session tasks waiting in the queue")
                    .register(registry);

            Gauge.builder("session.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed session tasks")
                    .register(registry);

            Gauge.builder("sessions.active", sessionRegistry, SessionRegistry::size)
                    .description("Ingestion sessions currently registered")
                    .register(registry);

            LOG.info("Session pool metrics registered: session.pool.* and sessions.active");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = sessionExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Session Pool Health: size={}/{}, active={}, queued={}, completed={}, sessions={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount(),
                sessionRegistry.size()
        );
    }
}
