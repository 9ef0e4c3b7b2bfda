package com.phillippitts.streamscribe.config;

import com.phillippitts.streamscribe.config.logging.MdcTaskDecorator;
import com.phillippitts.streamscribe.config.properties.ThreadPoolProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors the ingestion engine runs on.
 *
 * <p>Both pools use {@link CallerRunsUnlessShutdownPolicy}: when the pool and queue are
 * full the submitting thread runs the task, which slows the producer down instead of dropping
 * audio. After shutdown the task is rejected with an exception, so callers never wait on work
 * that will not run. Log4j2 ThreadContext is copied onto worker threads by {@link MdcTaskDecorator}.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Shared pool behind every per-session worker. Decoding, batching and transcription all
     * run here, one task per session at a time.
     */
    @Bean(name = "sessionExecutor")
    public ThreadPoolTaskExecutor sessionExecutor() {
        return buildExecutor(threadPoolProperties.getSession());
    }

    /**
     * Background pool for archiving finished sessions, so a slow object store never delays
     * the next session on the same session thread.
     */
    @Bean(name = "archiveExecutor")
    public ThreadPoolTaskExecutor archiveExecutor() {
        return buildExecutor(threadPoolProperties.getArchive());
    }

    /**
     * Scheduler for {@code @Scheduled} housekeeping. Declared by name because the WebSocket
     * configuration registers a SockJS scheduler of the same type.
     */
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("scheduler-");
        return scheduler;
    }

    private static ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new CallerRunsUnlessShutdownPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * {@link ThreadPoolExecutor.CallerRunsPolicy} that throws instead of silently discarding
     * the task once the pool is shut down.
     */
    static final class CallerRunsUnlessShutdownPolicy implements RejectedExecutionHandler {

        @Override
        public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
            if (executor.isShutdown()) {
                throw new RejectedExecutionException("Executor is shut down; task " + task + " rejected");
            }
            task.run();
        }
    }
}
