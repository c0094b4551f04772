package com.phillippitts.streamscribe.service.audio.segment;

/**
 * Destination for archived audio segments.
 */
public interface SegmentArchive {

    /**
     * Persists one segment.
     *
     * @param segment segment to store
     * @throws java.io.UncheckedIOException if the segment cannot be written
     */
    void store(AudioSegment segment);
}
