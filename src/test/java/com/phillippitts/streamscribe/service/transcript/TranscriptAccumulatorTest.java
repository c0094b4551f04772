package com.phillippitts.streamscribe.service.transcript;

import com.phillippitts.streamscribe.domain.TranscriptFragment;
import com.phillippitts.streamscribe.service.metrics.SessionMetrics;
import com.phillippitts.streamscribe.testutil.ManualTaskScheduler;
import com.phillippitts.streamscribe.testutil.MutableClock;
import com.phillippitts.streamscribe.testutil.RecordingFlushHandler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TranscriptAccumulatorTest {

    private static final Duration DWELL = Duration.ofMinutes(3);

    private MutableClock clock;
    private ManualTaskScheduler scheduler;
    private RecordingFlushHandler handler;
    private SimpleMeterRegistry registry;
    private TranscriptAccumulator accumulator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        scheduler = new ManualTaskScheduler(clock);
        handler = new RecordingFlushHandler();
        registry = new SimpleMeterRegistry();
        accumulator = new TranscriptAccumulator("s1", DWELL, 0.85, 15, scheduler, clock, handler,
                new SessionMetrics(registry));
    }

    private TranscriptFragment fin(String text, Integer speaker) {
        return new TranscriptFragment(text, speaker, true, clock.instant());
    }

    @Test
    void dropsNearDuplicateFinal() {
        assertThat(accumulator.accept(fin("hello there", 0))).isEqualTo(AcceptOutcome.ACCEPTED);
        assertThat(accumulator.accept(fin("hello there", 0))).isEqualTo(AcceptOutcome.DUPLICATE);

        assertThat(accumulator.flush(FlushTrigger.FORCED)).contains("hello there");
        assertThat(registry.find("streamscribe.transcript.fragments").tag("outcome", "duplicate")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void speakerChangeProducesLabeledTurns() {
        accumulator.accept(fin("I'll take the lead", 0));
        accumulator.accept(fin("sounds good", 1));

        String text = accumulator.flush(FlushTrigger.FORCED).orElseThrow();

        assertThat(text).contains("\n\n");
        assertThat(text.indexOf("Speaker 0:")).isLessThan(text.indexOf("Speaker 1:"));
        assertThat(text).isEqualTo("Speaker 0: I'll take the lead\n\nSpeaker 1: sounds good");
    }

    @Test
    void interimFragmentsNeverReachTheBuffer() {
        AcceptOutcome outcome = accumulator.accept(new TranscriptFragment("partial", 0, false, clock.instant()));

        assertThat(outcome).isEqualTo(AcceptOutcome.INTERIM_IGNORED);
        assertThat(accumulator.bufferedCharacters()).isZero();
        assertThat(accumulator.isFlushScheduled()).isFalse();
    }

    @Test
    void flushesAutomaticallyAfterDwellWithoutNewFinals() {
        accumulator.accept(fin("status update on the launch", 0));

        scheduler.advance(DWELL.minusSeconds(1));
        assertThat(handler.flushes()).isEmpty();

        scheduler.advance(Duration.ofSeconds(1));
        assertThat(handler.flushes()).hasSize(1);
        assertThat(handler.last().text()).isEqualTo("status update on the launch");
        assertThat(handler.last().trigger()).isEqualTo(FlushTrigger.INACTIVITY);
        assertThat(accumulator.isFlushScheduled()).isFalse();
    }

    @Test
    void eachAcceptedFinalPushesTheDeadlineBack() {
        accumulator.accept(fin("first thought", 0));
        scheduler.advance(Duration.ofMinutes(2));
        accumulator.accept(fin("second thought entirely", 0));

        scheduler.advance(Duration.ofMinutes(2));
        assertThat(handler.flushes()).isEmpty();
        assertThat(accumulator.remainingDwellMs()).isEqualTo(Duration.ofMinutes(1).toMillis());

        scheduler.advance(Duration.ofMinutes(1));
        assertThat(handler.texts()).containsExactly("first thought second thought entirely");
    }

    @Test
    void emptyFlushDoesNotCallHandler() {
        assertThat(accumulator.flush(FlushTrigger.FORCED)).isEmpty();
        assertThat(accumulator.flushAndClose()).isEmpty();

        assertThat(handler.flushes()).isEmpty();
    }

    @Test
    void forcedFlushCancelsPendingDeadline() {
        accumulator.accept(fin("something to say", 0));
        accumulator.flush(FlushTrigger.FORCED);

        scheduler.advance(DWELL.plusMinutes(1));

        assertThat(handler.flushes()).extracting(RecordingFlushHandler.Flush::trigger)
                .containsExactly(FlushTrigger.FORCED);
        assertThat(scheduler.pendingTasks()).isZero();
    }

    @Test
    void flushAndCloseIsIdempotentAndRejectsLaterFragments() {
        accumulator.accept(fin("final words", 0));

        Optional<String> first = accumulator.flushAndClose();
        Optional<String> second = accumulator.flushAndClose();

        assertThat(first).contains("final words");
        assertThat(second).isEmpty();
        assertThat(accumulator.isClosed()).isTrue();
        assertThat(accumulator.accept(fin("too late", 0))).isEqualTo(AcceptOutcome.REJECTED_CLOSED);
        assertThat(handler.flushes()).hasSize(1);
        assertThat(handler.last().trigger()).isEqualTo(FlushTrigger.TEARDOWN);
    }

    @Test
    void handlerFailureDoesNotRebufferText() {
        TranscriptAccumulator failing = new TranscriptAccumulator("s2", DWELL, 0.85, 15, scheduler, clock,
                (id, text, trigger) -> {
                    throw new IllegalStateException("downstream down");
                }, new SessionMetrics(registry));
        failing.accept(fin("lost to a bad sink", 0));

        assertThat(failing.flush(FlushTrigger.FORCED)).contains("lost to a bad sink");
        assertThat(failing.bufferedCharacters()).isZero();
    }

    @Test
    void duplicateDetectionSpansFlushes() {
        accumulator.accept(fin("we shipped version two", 0));
        accumulator.flush(FlushTrigger.FORCED);

        assertThat(accumulator.accept(fin("We shipped version two.", 0))).isEqualTo(AcceptOutcome.DUPLICATE);
    }

    @Test
    void concurrentAcceptAndFlushNeverLoseOrDuplicateText() throws Exception {
        int writers = 4;
        int perWriter = 50;
        ExecutorService pool = Executors.newFixedThreadPool(writers + 1);
        CountDownLatch start = new CountDownLatch(1);
        List<String> flushed = new ArrayList<>();
        try {
            for (int w = 0; w < writers; w++) {
                int writer = w;
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perWriter; i++) {
                        accumulator.accept(fin("w" + writer + "x" + i + "qz" + (writer * 1000 + i), null));
                    }
                    return null;
                });
            }
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < 20; i++) {
                    accumulator.flush(FlushTrigger.FORCED).ifPresent(t -> {
                        synchronized (flushed) {
                            flushed.add(t);
                        }
                    });
                }
                return null;
            });
            start.countDown();
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }
        accumulator.flushAndClose().ifPresent(flushed::add);

        long accepted = (long) registry.find("streamscribe.transcript.fragments").tag("outcome", "accepted")
                .counter().count();
        int words = flushed.stream().mapToInt(t -> t.split(" ").length).sum();
        assertThat(words).isEqualTo(accepted);
    }
}
