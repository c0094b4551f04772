package com.phillippitts.streamscribe.service.audio.segment;

/**
 * Archive used when {@code stream.archive.enabled=false}. Segments are discarded.
 */
public final class NoopSegmentArchive implements SegmentArchive {

    @Override
    public void store(AudioSegment segment) {
        // archival disabled
    }
}
