package com.phillippitts.streamscribe.service.downstream;

import com.phillippitts.streamscribe.service.downstream.event.TranscriptFlushedEvent;
import com.phillippitts.streamscribe.service.metrics.SessionMetrics;
import com.phillippitts.streamscribe.service.transcript.FlushHandler;
import com.phillippitts.streamscribe.service.transcript.FlushTrigger;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-log hand-off of flushed transcript blocks.
 *
 * <p>Each block is counted, published as a {@link TranscriptFlushedEvent} and delivered to
 * the {@link TranscriptSink} on the hand-off executor, so a slow analysis service never
 * stalls a session. Delivery failures are logged and counted; the text is not retried.
 */
public class TranscriptHandoff implements FlushHandler {

    private static final Logger LOG = LogManager.getLogger(TranscriptHandoff.class);

    private final TranscriptSink sink;
    private final Executor executor;
    private final ApplicationEventPublisher publisher;
    private final SessionMetrics metrics;
    private final Clock clock;

    public TranscriptHandoff(TranscriptSink sink,
                             Executor executor,
                             ApplicationEventPublisher publisher,
                             SessionMetrics metrics,
                             Clock clock) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void onFlush(String sessionId, String text, FlushTrigger trigger) {
        metrics.flushed(trigger.tag());
        publisher.publishEvent(new TranscriptFlushedEvent(sessionId, text, trigger, clock.instant()));
        try {
            executor.execute(() -> deliver(sessionId, text));
        } catch (RejectedExecutionException e) {
            metrics.handoffFailed();
            LOG.error("Hand-off queue rejected block for session {} ({} chars)", sessionId, text.length());
        }
    }

    private void deliver(String sessionId, String text) {
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put("sessionId", sessionId)) {
            sink.deliver(sessionId, text);
        } catch (RuntimeException e) {
            metrics.handoffFailed();
            LOG.warn("Downstream {} sink failed for session {}: {}", sink.name(), sessionId, e.toString());
        }
    }
}
