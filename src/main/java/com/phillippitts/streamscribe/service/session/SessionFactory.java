package com.phillippitts.streamscribe.service.session;

import com.phillippitts.streamscribe.config.properties.ArchiveProperties;
import com.phillippitts.streamscribe.config.properties.ConnectionProperties;
import com.phillippitts.streamscribe.config.properties.ProviderProperties;
import com.phillippitts.streamscribe.config.properties.TranscriptProperties;
import com.phillippitts.streamscribe.service.audio.decode.AudioFrameDecoderFactory;
import com.phillippitts.streamscribe.service.audio.segment.AudioSegmenter;
import com.phillippitts.streamscribe.service.audio.segment.SegmentArchive;
import com.phillippitts.streamscribe.service.metrics.SessionMetrics;
import com.phillippitts.streamscribe.service.transcript.FlushHandler;
import com.phillippitts.streamscribe.service.transcript.TranscriptAccumulator;
import com.phillippitts.streamscribe.service.upstream.UpstreamConnector;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Assembles the per-session object graph. Construction performs no I/O, so it is safe to run
 * inside a concurrent map's compute function.
 */
public class SessionFactory {

    private final AudioFrameDecoderFactory decoders;
    private final SegmentArchive archive;
    private final UpstreamConnector connector;
    private final FlushHandler flushHandler;
    private final TaskScheduler scheduler;
    private final Executor ioExecutor;
    private final Clock clock;
    private final SessionMetrics metrics;
    private final ConnectionProperties connectionProps;
    private final TranscriptProperties transcriptProps;
    private final Duration connectTimeout;
    private final Duration segmentLength;

    public SessionFactory(AudioFrameDecoderFactory decoders,
                          SegmentArchive archive,
                          UpstreamConnector connector,
                          FlushHandler flushHandler,
                          TaskScheduler scheduler,
                          Executor ioExecutor,
                          Clock clock,
                          SessionMetrics metrics,
                          ProviderProperties providerProps,
                          ConnectionProperties connectionProps,
                          TranscriptProperties transcriptProps,
                          ArchiveProperties archiveProps) {
        this.decoders = Objects.requireNonNull(decoders, "decoders");
        this.archive = Objects.requireNonNull(archive, "archive");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.flushHandler = Objects.requireNonNull(flushHandler, "flushHandler");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.connectionProps = Objects.requireNonNull(connectionProps, "connectionProps");
        this.transcriptProps = Objects.requireNonNull(transcriptProps, "transcriptProps");
        this.connectTimeout = Duration.ofMillis(providerProps.getConnectTimeoutMs());
        this.segmentLength = Duration.ofSeconds(archiveProps.getSegmentSeconds());
    }

    public Session create(String sessionId, SessionEndListener endListener) {
        TranscriptAccumulator accumulator = new TranscriptAccumulator(
                sessionId,
                Duration.ofMillis(transcriptProps.getFlushDwellMs()),
                transcriptProps.getDuplicateThreshold(),
                transcriptProps.getRecentWindowSize(),
                scheduler,
                clock,
                flushHandler,
                metrics);
        AudioSegmenter segmenter = new AudioSegmenter(sessionId, decoders.outputFormat(), segmentLength, archive);
        return new Session(
                sessionId,
                clock,
                decoders.create(),
                segmenter,
                accumulator,
                callbacks -> new ConnectionSupervisor(sessionId, connector, connectionProps, connectTimeout,
                        scheduler, ioExecutor, clock, metrics, callbacks),
                endListener,
                metrics);
    }
}
