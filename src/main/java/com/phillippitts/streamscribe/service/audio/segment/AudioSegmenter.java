package com.phillippitts.streamscribe.service.audio.segment;

import com.phillippitts.streamscribe.service.audio.AudioFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.time.Duration;
import java.util.Objects;

/**
 * Cuts a session's decoded PCM stream into fixed-length segments.
 *
 * <p>Every emitted segment except the last holds exactly the target duration; bytes beyond
 * a segment boundary carry over into the next one. {@link #finish()} emits the partial
 * remainder. Archive failures are logged and never interrupt the stream.
 */
public class AudioSegmenter {

    private static final Logger LOG = LogManager.getLogger(AudioSegmenter.class);

    private final String sessionId;
    private final AudioFormat format;
    private final int segmentBytes;
    private final SegmentArchive archive;

    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private long nextIndex;
    private boolean finished;

    public AudioSegmenter(String sessionId, AudioFormat format, Duration segmentLength, SegmentArchive archive) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.format = Objects.requireNonNull(format, "format");
        this.archive = Objects.requireNonNull(archive, "archive");
        this.segmentBytes = format.bytesFor(Objects.requireNonNull(segmentLength, "segmentLength"));
        if (segmentBytes <= 0) {
            throw new IllegalArgumentException("segment length too short: " + segmentLength);
        }
    }

    /**
     * Appends decoded PCM, emitting every segment that becomes complete.
     *
     * @param pcm decoded audio (may be empty)
     */
    public synchronized void append(byte[] pcm) {
        if (finished || pcm == null || pcm.length == 0) {
            return;
        }
        int offset = 0;
        while (offset < pcm.length) {
            int room = segmentBytes - pending.size();
            int take = Math.min(room, pcm.length - offset);
            pending.write(pcm, offset, take);
            offset += take;
            if (pending.size() == segmentBytes) {
                emit();
            }
        }
    }

    /** Emits any partial remainder and stops accepting audio. */
    public synchronized void finish() {
        if (finished) {
            return;
        }
        finished = true;
        if (pending.size() > 0) {
            emit();
        }
    }

    public synchronized long segmentsEmitted() {
        return nextIndex;
    }

    private void emit() {
        AudioSegment segment = new AudioSegment(sessionId, nextIndex++, format, pending.toByteArray());
        pending.reset();
        try {
            archive.store(segment);
        } catch (RuntimeException e) {
            LOG.warn("Failed to archive segment {} for session {}: {}", segment.index(), sessionId, e.toString());
        }
    }
}
