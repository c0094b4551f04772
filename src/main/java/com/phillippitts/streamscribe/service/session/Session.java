package com.phillippitts.streamscribe.service.session;

import com.phillippitts.streamscribe.domain.ConnectionState;
import com.phillippitts.streamscribe.domain.SessionSnapshot;
import com.phillippitts.streamscribe.domain.TranscriptFragment;
import com.phillippitts.streamscribe.exception.AudioDecodeException;
import com.phillippitts.streamscribe.exception.SessionTerminatedException;
import com.phillippitts.streamscribe.service.audio.decode.AudioFrameDecoder;
import com.phillippitts.streamscribe.service.audio.segment.AudioSegmenter;
import com.phillippitts.streamscribe.service.metrics.SessionMetrics;
import com.phillippitts.streamscribe.service.transcript.AcceptOutcome;
import com.phillippitts.streamscribe.service.transcript.FlushTrigger;
import com.phillippitts.streamscribe.service.transcript.TranscriptAccumulator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * One audio source's transcription lifecycle: decoder, segmenter, connection supervisor and
 * transcript accumulator, created together and torn down together.
 *
 * <p>Audio flows {@code packet → decoder → PCM → segmenter (archive) + supervisor (provider)}.
 * Provider fragments flow {@code supervisor → accumulator}. {@link #close(CloseReason)} flushes
 * the transcript before any resource is released and is idempotent.
 */
public class Session {

    private static final Logger LOG = LogManager.getLogger(Session.class);

    private final String id;
    private final Instant createdAt;
    private final Clock clock;
    private final AudioFrameDecoder decoder;
    private final AudioSegmenter segmenter;
    private final TranscriptAccumulator accumulator;
    private final ConnectionSupervisor supervisor;
    private final SessionEndListener endListener;
    private final SessionMetrics metrics;
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile Instant lastActivity;
    private volatile CloseReason closeReason;

    Session(String id,
            Clock clock,
            AudioFrameDecoder decoder,
            AudioSegmenter segmenter,
            TranscriptAccumulator accumulator,
            Function<SupervisorCallbacks, ConnectionSupervisor> supervisorFactory,
            SessionEndListener endListener,
            SessionMetrics metrics) {
        this.id = Objects.requireNonNull(id, "id");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.segmenter = Objects.requireNonNull(segmenter, "segmenter");
        this.accumulator = Objects.requireNonNull(accumulator, "accumulator");
        this.endListener = Objects.requireNonNull(endListener, "endListener");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.createdAt = clock.instant();
        this.lastActivity = createdAt;
        this.supervisor = supervisorFactory.apply(new Callbacks());
    }

    public String id() {
        return id;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /** Last genuine audio packet or provider fragment. */
    public Instant lastActivity() {
        return lastActivity;
    }

    public ConnectionState state() {
        return supervisor.state();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /** Reason passed to the first {@link #close(CloseReason)}, or null while open. */
    public CloseReason closeReason() {
        return closeReason;
    }

    /** Opens the provider connection ahead of the first packet. */
    public void start() {
        ensureOpen();
        supervisor.start();
    }

    /**
     * Decodes one compressed packet and forwards the PCM. A packet that fails to decode is
     * logged, counted and dropped; the stream continues.
     *
     * @throws SessionTerminatedException if the session has ended
     */
    public void acceptAudio(byte[] packet) {
        ensureOpen();
        lastActivity = clock.instant();
        byte[] pcm;
        try {
            pcm = decoder.decode(packet);
        } catch (AudioDecodeException e) {
            metrics.decodeError();
            LOG.debug("Session {} dropped undecodable packet: {}", id, e.getMessage());
            return;
        }
        if (pcm.length == 0) {
            return;
        }
        segmenter.append(pcm);
        supervisor.sendAudio(pcm);
    }

    /** Caller-forced flush. */
    public Optional<String> flushNow() {
        return accumulator.flush(FlushTrigger.FORCED);
    }

    /**
     * Tears the session down: final transcript flush, then connection close, archive of the
     * partial segment and decoder release. The accumulator is closed before the socket, so
     * fragments the provider emits while the connection winds down are rejected.
     *
     * @return true if this call closed the session, false if it was already closed
     */
    public boolean close(CloseReason reason) {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        closeReason = reason;
        accumulator.flushAndClose();
        supervisor.shutdown(reason);
        segmenter.finish();
        decoder.close();
        metrics.sessionClosed(reason.tag());
        return true;
    }

    public SessionSnapshot snapshot() {
        return new SessionSnapshot(
                id,
                supervisor.state(),
                supervisor.attempts(),
                createdAt,
                lastActivity,
                accumulator.bufferedCharacters(),
                accumulator.bufferedWords(),
                accumulator.isFlushScheduled(),
                accumulator.remainingDwellMs(),
                segmenter.segmentsEmitted(),
                decoder.failedPackets());
    }

    /** Visible for tests */
    ConnectionSupervisor supervisor() {
        return supervisor;
    }

    /** Visible for tests */
    TranscriptAccumulator accumulator() {
        return accumulator;
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new SessionTerminatedException(id, supervisor.state().name());
        }
    }

    private final class Callbacks implements SupervisorCallbacks {

        @Override
        public void onTranscript(TranscriptFragment fragment) {
            if (fragment.isFinal()) {
                lastActivity = clock.instant();
            }
            AcceptOutcome outcome = accumulator.accept(fragment);
            LOG.trace("Session {} fragment {} (final={})", id, outcome, fragment.isFinal());
        }

        @Override
        public void onEnded(CloseReason reason) {
            endListener.sessionEnded(Session.this, reason);
        }
    }
}
