package com.phillippitts.streamscribe.service.audio.segment;

import com.phillippitts.streamscribe.service.audio.AudioFormat;
import com.phillippitts.streamscribe.service.audio.WavWriter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class WavSegmentArchiveTest {

    @TempDir
    Path root;

    @Test
    void writesZeroPaddedSegmentsPerSession() throws IOException {
        WavSegmentArchive archive = new WavSegmentArchive(root);

        archive.store(new AudioSegment("device-1", 0, AudioFormat.PCM16_MONO_16K, new byte[64]));
        archive.store(new AudioSegment("device-1", 1, AudioFormat.PCM16_MONO_16K, new byte[64]));

        Path first = root.resolve("device-1").resolve("segment-000000.wav");
        Path second = root.resolve("device-1").resolve("segment-000001.wav");
        assertThat(first).exists();
        assertThat(second).exists();
        assertThat(Files.size(first)).isEqualTo(WavWriter.WAV_HEADER_SIZE + 64);
    }

    @Test
    void sessionIdCannotEscapeArchiveRoot() {
        WavSegmentArchive archive = new WavSegmentArchive(root);

        Path dir = archive.sessionDirectory("../../etc");

        assertThat(dir.normalize()).startsWith(root);
        assertThat(dir.getParent()).isEqualTo(root);
    }

    @Test
    void fileNameSortsByIndex() {
        assertThat(WavSegmentArchive.fileName(7)).isEqualTo("segment-000007.wav");
        assertThat(WavSegmentArchive.fileName(123456)).isEqualTo("segment-123456.wav");
    }
}
