package com.phillippitts.streamscribe.testutil;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Virtual-time {@link TaskScheduler}. Nothing runs until the test calls {@link #advance(Duration)},
 * which moves the shared {@link MutableClock} task by task and runs each task on the calling
 * thread at its due time. Tasks scheduled by a running task are honored within the same advance.
 */
public class ManualTaskScheduler implements TaskScheduler {

    private final MutableClock clock;
    private final List<ManualFuture> tasks = new ArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    public ManualTaskScheduler(MutableClock clock) {
        this.clock = clock;
    }

    public MutableClock clock() {
        return clock;
    }

    /**
     * Moves time forward, running every task that becomes due.
     *
     * @return number of task executions
     */
    public int advance(Duration duration) {
        Instant target = clock.instant().plus(duration);
        int executed = 0;
        while (true) {
            ManualFuture next = nextDue(target);
            if (next == null) {
                break;
            }
            if (next.dueAt.isAfter(clock.instant())) {
                clock.setInstant(next.dueAt);
            }
            next.runOnce();
            executed++;
        }
        clock.setInstant(target);
        return executed;
    }

    /** Runs the tasks that are already due without moving time. */
    public int runDue() {
        return advance(Duration.ZERO);
    }

    /** Tasks that are scheduled and not cancelled. */
    public synchronized int pendingTasks() {
        return (int) tasks.stream().filter(t -> !t.cancelled).count();
    }

    @Override
    public Clock getClock() {
        return clock;
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Trigger trigger) {
        throw new UnsupportedOperationException("Trigger scheduling is not supported");
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Instant startTime) {
        return add(task, startTime, null);
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Instant startTime, Duration period) {
        return add(task, startTime, period);
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Duration period) {
        return add(task, clock.instant(), period);
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Instant startTime, Duration delay) {
        return add(task, startTime, delay);
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Duration delay) {
        return add(task, clock.instant(), delay);
    }

    private synchronized ManualFuture add(Runnable task, Instant dueAt, Duration period) {
        ManualFuture future = new ManualFuture(task, dueAt, period, sequence.incrementAndGet());
        tasks.add(future);
        return future;
    }

    private synchronized ManualFuture nextDue(Instant target) {
        tasks.removeIf(t -> t.cancelled);
        ManualFuture next = tasks.stream()
                .filter(t -> !t.dueAt.isAfter(target))
                .min(Comparator.comparing((ManualFuture t) -> t.dueAt).thenComparingLong(t -> t.seq))
                .orElse(null);
        if (next != null && next.period == null) {
            tasks.remove(next);
        }
        return next;
    }

    private final class ManualFuture implements ScheduledFuture<Object> {

        private final Runnable task;
        private final Duration period;
        private final long seq;
        private volatile Instant dueAt;
        private volatile boolean cancelled;
        private volatile boolean done;

        private ManualFuture(Runnable task, Instant dueAt, Duration period, long seq) {
            this.task = task;
            this.dueAt = dueAt;
            this.period = period;
            this.seq = seq;
        }

        private void runOnce() {
            if (period != null) {
                dueAt = dueAt.plus(period);
            } else {
                done = true;
            }
            task.run();
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(Duration.between(clock.instant(), dueAt));
        }

        @Override
        public int compareTo(Delayed other) {
            return Long.compare(getDelay(TimeUnit.NANOSECONDS), other.getDelay(TimeUnit.NANOSECONDS));
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (done || cancelled) {
                return false;
            }
            cancelled = true;
            return true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return done || cancelled;
        }

        @Override
        public Object get() {
            return null;
        }

        @Override
        public Object get(long timeout, TimeUnit unit) {
            return null;
        }
    }
}
