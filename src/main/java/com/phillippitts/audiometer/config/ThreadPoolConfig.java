package com.phillippitts.audiometer.config;

import com.phillippitts.audiometer.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools that keep file I/O and metering off the
 * WebSocket container threads.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and the expected number of sessions.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the pool that drains recording queues to disk.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.recording.*} properties:
     * <ul>
     *   <li>Core pool: default 2</li>
     *   <li>Max pool: default 4</li>
     *   <li>Queue: default 100 drain tasks</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. Each recording
     * submits at most one drain task at a time, so saturation means many concurrent
     * recordings; the caller then writes its own chunk instead of losing it.
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext from the submitting thread so
     * writer logs carry the session id.
     *
     * @return executor for recording writes
     */
    @Bean(name = "recordingExecutor")
    public ThreadPoolTaskExecutor recordingExecutor() {
        ThreadPoolProperties.RecordingPoolProperties props = threadPoolProperties.getRecording();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Creates the scheduler that runs every session's metering tick.
     *
     * <p>Ticks set their own {@code sessionId} in the ThreadContext, so no decorator is
     * needed here.
     *
     * @return scheduler for periodic metering
     */
    @Bean(name = "meteringTaskScheduler")
    public ThreadPoolTaskScheduler meteringTaskScheduler() {
        ThreadPoolProperties.MeteringPoolProperties props = threadPoolProperties.getMetering();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
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
