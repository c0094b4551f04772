package com.phillippitts.streamscribe.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
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
 * Configuration for thread pool metrics exposure via Micrometer.
 *
 * <p>Exposes, for the {@code upstream} and {@code handoff} pools (tag {@code pool}):
 * <ul>
 *   <li>streamscribe.pool.size - Current number of threads in the pool</li>
 *   <li>streamscribe.pool.active - Number of actively executing tasks</li>
 *   <li>streamscribe.pool.queued - Number of tasks waiting in the queue</li>
 *   <li>streamscribe.pool.completed - Cumulative count of completed tasks</li>
 * </ul>
 *
 * <p>Additionally logs a health summary every 5 minutes for operational visibility.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> upstreamExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> handoffExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("upstreamExecutor") ObjectProvider<ThreadPoolTaskExecutor> upstreamExecutorProvider,
            @Qualifier("handoffExecutor") ObjectProvider<ThreadPoolTaskExecutor> handoffExecutorProvider) {
        this.upstreamExecutorProvider = upstreamExecutorProvider;
        this.handoffExecutorProvider = handoffExecutorProvider;
    }

    /**
     * Binds session thread pool metrics to Micrometer registry.
     *
     * @return MeterBinder that registers custom metrics
     */
    @Bean
    public MeterBinder sessionExecutorMetrics() {
        return registry -> {
            bind(registry, "upstream", upstreamExecutorProvider.getObject().getThreadPoolExecutor());
            bind(registry, "handoff", handoffExecutorProvider.getObject().getThreadPoolExecutor());
            LOG.info("Thread pool metrics registered: streamscribe.pool.* available via /actuator/metrics");
        };
    }

    /**
     * Logs thread pool health summary every 5 minutes for operational monitoring.
     */
    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        logPool("upstream", upstreamExecutorProvider.getObject().getThreadPoolExecutor());
        logPool("handoff", handoffExecutorProvider.getObject().getThreadPoolExecutor());
    }

    private static void bind(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Gauge.builder("streamscribe.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("streamscribe.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing tasks")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("streamscribe.pool.queued", executor, e -> e.getQueue().size())
                .description("Number of tasks waiting in the queue")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("streamscribe.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed tasks")
                .tag("pool", pool)
                .register(registry);
    }

    private static void logPool(String pool, ThreadPoolExecutor executor) {
        LOG.info("{} pool health: size={}/{}, active={}, queued={}, completed={}",
                pool,
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount()
        );
    }
}
