package com.phillippitts.streamscribe.service.audio.segment;

import com.phillippitts.streamscribe.service.audio.AudioFormat;

import java.time.Duration;
import java.util.Objects;

/**
 * A contiguous run of decoded PCM cut from one session's stream.
 *
 * @param sessionId owning session
 * @param index     0-based position in the session's segment sequence
 * @param format    PCM format of {@code pcm}
 * @param pcm       little-endian PCM samples
 */
public record AudioSegment(String sessionId, long index, AudioFormat format, byte[] pcm) {

    public AudioSegment {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(pcm, "pcm");
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative");
        }
    }

    public Duration duration() {
        return Duration.ofMillis(pcm.length * 1000L / format.byteRate());
    }
}
