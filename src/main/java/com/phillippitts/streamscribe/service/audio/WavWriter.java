package com.phillippitts.streamscribe.service.audio;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes minimal PCM WAV files (44-byte RIFF header followed by the raw samples).
 */
public final class WavWriter {

    /** Size of the canonical PCM WAV header. */
    public static final int WAV_HEADER_SIZE = 44;

    private WavWriter() {}

    /**
     * Writes a WAV file containing the given little-endian PCM payload.
     *
     * @param pcm     raw PCM in {@code format}
     * @param format  format of the payload
     * @param wavPath output file path (will be created or overwritten)
     * @throws UncheckedIOException if the file cannot be written
     */
    public static void write(byte[] pcm, AudioFormat format, Path wavPath) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(wavPath, "wavPath must not be null");
        try (OutputStream os = Files.newOutputStream(wavPath)) {
            int dataSize = pcm.length;

            os.write(new byte[] { 'R', 'I', 'F', 'F' });
            writeLEInt(os, 36 + dataSize);
            os.write(new byte[] { 'W', 'A', 'V', 'E' });

            os.write(new byte[] { 'f', 'm', 't', ' ' });
            writeLEInt(os, 16);
            writeLEShort(os, (short) 1); // PCM
            writeLEShort(os, (short) format.channels());
            writeLEInt(os, format.sampleRate());
            writeLEInt(os, format.byteRate());
            writeLEShort(os, (short) format.blockAlign());
            writeLEShort(os, (short) format.bitsPerSample());

            os.write(new byte[] { 'd', 'a', 't', 'a' });
            writeLEInt(os, dataSize);

            os.write(pcm);
            os.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write WAV file to " + wavPath, e);
        }
    }

    private static void writeLEShort(OutputStream os, short v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
