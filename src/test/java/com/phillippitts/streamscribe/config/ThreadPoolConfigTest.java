package com.phillippitts.streamscribe.config;

import com.phillippitts.streamscribe.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    private final ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateExecutorsWithDefaultConfiguration() {
        ThreadPoolTaskExecutor upstream = config.upstreamExecutor();
        ThreadPoolTaskExecutor handoff = config.handoffExecutor();
        try {
            assertThat(upstream.getCorePoolSize()).isEqualTo(2);
            assertThat(upstream.getMaxPoolSize()).isEqualTo(8);
            assertThat(upstream.getThreadNamePrefix()).isEqualTo("upstream-pool-");
            assertThat(handoff.getCorePoolSize()).isEqualTo(1);
            assertThat(handoff.getMaxPoolSize()).isEqualTo(4);
            assertThat(handoff.getThreadNamePrefix()).isEqualTo("handoff-pool-");
        } finally {
            upstream.shutdown();
            handoff.shutdown();
        }
    }

    @Test
    void shouldPropagateThreadContextToWorkers() throws InterruptedException {
        ThreadPoolTaskExecutor handoff = config.handoffExecutor();
        try {
            CountDownLatch latch = new CountDownLatch(1);
            AtomicReference<String> seen = new AtomicReference<>();
            AtomicReference<String> threadName = new AtomicReference<>();

            ThreadContext.put("sessionId", "device-1");
            handoff.execute(() -> {
                seen.set(ThreadContext.get("sessionId"));
                threadName.set(Thread.currentThread().getName());
                latch.countDown();
            });

            assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(seen.get()).isEqualTo("device-1");
            assertThat(threadName.get()).startsWith("handoff-pool-");
        } finally {
            handoff.shutdown();
        }
    }

    @Test
    void shouldRunScheduledTasksOnTimerThreads() throws InterruptedException {
        ThreadPoolTaskScheduler scheduler = config.sessionScheduler();
        try {
            CountDownLatch latch = new CountDownLatch(1);
            AtomicReference<String> threadName = new AtomicReference<>();

            scheduler.schedule(() -> {
                threadName.set(Thread.currentThread().getName());
                latch.countDown();
            }, Instant.now().plusMillis(10));

            assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(threadName.get()).startsWith("session-timer-");
        } finally {
            scheduler.shutdown();
        }
    }
}
