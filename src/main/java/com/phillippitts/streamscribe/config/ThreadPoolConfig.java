package com.phillippitts.streamscribe.config;

import com.phillippitts.streamscribe.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for session work.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on the expected number of concurrent sessions.
 */
@Configuration
public class ThreadPoolConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolConfig.class);

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for per-session socket work: connect attempts, keep-alive writes and
     * auto-close teardown. Timers on the shared scheduler only hand work to this pool.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When the pool and queue
     * are full, the caller thread starts the attempt itself, providing backpressure instead of
     * losing a reconnect.
     *
     * @return Configured executor for upstream socket work
     */
    @Bean(name = "upstreamExecutor")
    public ThreadPoolTaskExecutor upstreamExecutor() {
        ThreadPoolTaskExecutor executor = newExecutor(threadPoolProperties.getUpstream());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Executor for downstream transcript delivery.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. Hand-off is best-effort; a
     * full queue is logged and counted by the caller rather than stalling a session.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext from the flushing thread to the worker thread.
     *
     * @return Configured executor for transcript hand-off
     */
    @Bean(name = "handoffExecutor")
    public ThreadPoolTaskExecutor handoffExecutor() {
        ThreadPoolTaskExecutor executor = newExecutor(threadPoolProperties.getHandoff());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Shared scheduler for per-session timers (flush dwell, keep-alive, auto-close, backoff)
     * and the health sweep. Keep-alive and auto-close ticks dispatch to the upstream executor.
     *
     * @return Configured task scheduler
     */
    @Bean(name = {"sessionScheduler", "taskScheduler"})
    public ThreadPoolTaskScheduler sessionScheduler() {
        ThreadPoolProperties.SchedulerProperties props = threadPoolProperties.getScheduler();
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setErrorHandler(t -> LOG.error("Session timer task failed", t));
        scheduler.initialize();
        return scheduler;
    }

    private static ThreadPoolTaskExecutor newExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        return executor;
    }

    /** Copies the submitting thread's ThreadContext into the worker for the task's duration. */
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
