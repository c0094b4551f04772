package com.phillippitts.streamscribe.service.audio.segment;

import com.phillippitts.streamscribe.service.audio.WavWriter;
import com.phillippitts.streamscribe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes segments as {@code <root>/<sessionId>/segment-<index>.wav}, index zero-padded to six digits.
 */
public final class WavSegmentArchive implements SegmentArchive {

    private static final Logger LOG = LogManager.getLogger(WavSegmentArchive.class);

    private final Path root;

    public WavSegmentArchive(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    @Override
    public void store(AudioSegment segment) {
        Path dir = sessionDirectory(segment.sessionId());
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create archive directory " + dir, e);
        }
        Path file = dir.resolve(fileName(segment.index()));
        WavWriter.write(segment.pcm(), segment.format(), file);
        LOG.debug("Archived segment {} ({} bytes) to {}", segment.index(), segment.pcm().length, file);
    }

    static String fileName(long index) {
        return String.format("segment-%06d.wav", index);
    }

    Path sessionDirectory(String sessionId) {
        // session ids come from clients; keep them from escaping the archive root
        String safe = LogSanitizer.toFileName(sessionId);
        return root.resolve(safe);
    }
}
