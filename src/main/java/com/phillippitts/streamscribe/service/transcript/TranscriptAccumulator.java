package com.phillippitts.streamscribe.service.transcript;

import com.phillippitts.streamscribe.domain.TranscriptFragment;
import com.phillippitts.streamscribe.service.metrics.SessionMetrics;
import com.phillippitts.streamscribe.util.LogSanitizer;
import com.phillippitts.streamscribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Buffers final transcript fragments for one session and releases them as text blocks.
 *
 * <p><b>Acceptance:</b> only final fragments mutate the buffer. A fragment whose Dice
 * similarity against any fragment in the recent window is strictly above the duplicate
 * threshold is discarded. Accepted fragments are appended to the {@link TranscriptBuffer}
 * (same speaker joins the turn, a new speaker starts one) and re-arm the dwell deadline.
 *
 * <p><b>Flush:</b> the block is released when the dwell deadline passes with no new
 * fragment, when a caller forces it, or at teardown. Flushing an empty buffer is a no-op and
 * never reaches the {@link FlushHandler}. The handler runs outside the lock; its failures are
 * logged and the text is not re-buffered.
 *
 * <p><b>Timers:</b> every re-arm cancels the previous deadline and bumps a generation
 * counter; a deadline task that fires late for an older generation does nothing.
 *
 * <p><b>Thread Safety:</b> all state is guarded by a single {@link ReentrantLock}.
 */
public class TranscriptAccumulator {

    private static final Logger LOG = LogManager.getLogger(TranscriptAccumulator.class);

    private static final int PREVIEW_CHARS = 60;

    private final String sessionId;
    private final Duration dwell;
    private final double duplicateThreshold;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final FlushHandler handler;
    private final SessionMetrics metrics;

    private final ReentrantLock lock = new ReentrantLock();
    private final TranscriptBuffer buffer = new TranscriptBuffer();
    private final RecentFragmentWindow recent;

    private ScheduledFuture<?> pendingFlush;
    private Instant deadline;
    private long generation;
    private boolean closed;

    public TranscriptAccumulator(String sessionId,
                                 Duration dwell,
                                 double duplicateThreshold,
                                 int recentWindowSize,
                                 TaskScheduler scheduler,
                                 Clock clock,
                                 FlushHandler handler,
                                 SessionMetrics metrics) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.dwell = Objects.requireNonNull(dwell, "dwell");
        if (dwell.isNegative() || dwell.isZero()) {
            throw new IllegalArgumentException("dwell must be positive");
        }
        if (duplicateThreshold < 0.0 || duplicateThreshold > 1.0) {
            throw new IllegalArgumentException("duplicateThreshold must be in [0,1]");
        }
        this.duplicateThreshold = duplicateThreshold;
        this.recent = new RecentFragmentWindow(recentWindowSize);
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Offers one provider fragment.
     *
     * @param fragment fragment in provider arrival order
     * @return what happened to the fragment
     */
    public AcceptOutcome accept(TranscriptFragment fragment) {
        Objects.requireNonNull(fragment, "fragment");
        AcceptOutcome outcome;
        lock.lock();
        try {
            outcome = acceptLocked(fragment);
        } finally {
            lock.unlock();
        }
        metrics.fragment(outcome.tag());
        if (outcome == AcceptOutcome.DUPLICATE) {
            LOG.debug("Dropped near-duplicate fragment for session {}: '{}'",
                    sessionId, LogSanitizer.truncate(fragment.text(), PREVIEW_CHARS));
        }
        return outcome;
    }

    /**
     * Releases the buffered block now.
     *
     * @param trigger why the flush happens
     * @return the released text, empty when nothing was buffered
     */
    public Optional<String> flush(FlushTrigger trigger) {
        String text;
        lock.lock();
        try {
            text = drainLocked();
        } finally {
            lock.unlock();
        }
        return deliver(text, trigger);
    }

    /**
     * Final flush: releases the buffer and rejects every later fragment, atomically.
     * Idempotent; a second call returns empty.
     *
     * @return the released text, empty when nothing was buffered
     */
    public Optional<String> flushAndClose() {
        String text;
        lock.lock();
        try {
            if (closed) {
                return Optional.empty();
            }
            closed = true;
            text = drainLocked();
        } finally {
            lock.unlock();
        }
        return deliver(text, FlushTrigger.TEARDOWN);
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int bufferedCharacters() {
        lock.lock();
        try {
            return buffer.characters();
        } finally {
            lock.unlock();
        }
    }

    public int bufferedWords() {
        lock.lock();
        try {
            return buffer.words();
        } finally {
            lock.unlock();
        }
    }

    public boolean isFlushScheduled() {
        lock.lock();
        try {
            return deadline != null;
        } finally {
            lock.unlock();
        }
    }

    /** Milliseconds until the inactivity flush fires, 0 when none is pending. */
    public long remainingDwellMs() {
        lock.lock();
        try {
            return TimeUtils.remainingMillis(clock.instant(), deadline);
        } finally {
            lock.unlock();
        }
    }

    /** Current rendering of the buffer without clearing it. */
    public String preview() {
        lock.lock();
        try {
            return buffer.render();
        } finally {
            lock.unlock();
        }
    }

    private AcceptOutcome acceptLocked(TranscriptFragment fragment) {
        if (closed) {
            return AcceptOutcome.REJECTED_CLOSED;
        }
        if (!fragment.isFinal()) {
            return AcceptOutcome.INTERIM_IGNORED;
        }
        String text = fragment.text();
        if (recent.maxSimilarity(text) > duplicateThreshold) {
            return AcceptOutcome.DUPLICATE;
        }
        buffer.append(text, fragment.speaker());
        recent.add(text);
        rescheduleLocked();
        return AcceptOutcome.ACCEPTED;
    }

    private void rescheduleLocked() {
        cancelTimerLocked();
        long myGeneration = ++generation;
        deadline = clock.instant().plus(dwell);
        pendingFlush = scheduler.schedule(() -> onDeadline(myGeneration), deadline);
    }

    private void onDeadline(long firedGeneration) {
        String text;
        lock.lock();
        try {
            if (closed || firedGeneration != generation) {
                return;
            }
            pendingFlush = null;
            text = drainLocked();
        } finally {
            lock.unlock();
        }
        deliver(text, FlushTrigger.INACTIVITY);
    }

    private String drainLocked() {
        cancelTimerLocked();
        generation++;
        return buffer.isEmpty() ? "" : buffer.drain();
    }

    private void cancelTimerLocked() {
        if (pendingFlush != null) {
            pendingFlush.cancel(false);
            pendingFlush = null;
        }
        deadline = null;
    }

    private Optional<String> deliver(String text, FlushTrigger trigger) {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        LOG.info("Flushing {} chars for session {} (trigger={})", text.length(), sessionId, trigger.tag());
        try {
            handler.onFlush(sessionId, text, trigger);
        } catch (RuntimeException e) {
            LOG.error("Transcript hand-off failed for session {}: {}", sessionId, e.toString());
        }
        return Optional.of(text);
    }
}
