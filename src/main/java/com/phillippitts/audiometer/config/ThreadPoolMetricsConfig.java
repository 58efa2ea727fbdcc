package com.phillippitts.audiometer.config;

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
 * Exposes the recording writer pool through Micrometer.
 *
 * <ul>
 *   <li>recording.pool.size - current number of threads</li>
 *   <li>recording.pool.active - threads currently writing</li>
 *   <li>recording.pool.queued - drain tasks waiting for a thread</li>
 *   <li>recording.pool.completed - cumulative drain tasks completed</li>
 * </ul>
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> recordingExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("recordingExecutor") ObjectProvider<ThreadPoolTaskExecutor> recordingExecutorProvider) {
        this.recordingExecutorProvider = recordingExecutorProvider;
    }

    @Bean
    public MeterBinder recordingExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = recordingExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("recording.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the recording pool")
                    .register(registry);

            Gauge.builder("recording.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads actively writing recordings")
                    .register(registry);

            Gauge.builder("recording.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of recording drain tasks waiting in the queue")
                    .register(registry);

            Gauge.builder("recording.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed recording drain tasks")
                    .register(registry);

            LOG.info("Recording thread pool metrics registered: recording.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = recordingExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Recording Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
