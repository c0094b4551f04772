package com.phillippitts.streamscribe.service.audio;

import java.time.Duration;

/**
 * Linear PCM format negotiated with the STT provider at connect time.
 * Samples are signed and little-endian.
 *
 * @param sampleRate    sample rate in Hz
 * @param channels      channel count
 * @param bitsPerSample bits per sample (multiple of 8)
 */
public record AudioFormat(int sampleRate, int channels, int bitsPerSample) {

    /** 16 kHz, 16-bit, mono: what the BLE device and the provider default to. */
    public static final AudioFormat PCM16_MONO_16K = new AudioFormat(16_000, 1, 16);

    public AudioFormat {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
        if (channels <= 0) {
            throw new IllegalArgumentException("channels must be positive, got: " + channels);
        }
        if (bitsPerSample <= 0 || bitsPerSample % 8 != 0) {
            throw new IllegalArgumentException("bitsPerSample must be a positive multiple of 8, got: " + bitsPerSample);
        }
    }

    /** Bytes per PCM frame (one sample for every channel). */
    public int blockAlign() {
        return (bitsPerSample / 8) * channels;
    }

    /** Bytes per second of audio. */
    public int byteRate() {
        return sampleRate * blockAlign();
    }

    /**
     * Number of bytes holding the given duration of audio, rounded down to a whole frame.
     *
     * @param duration audio duration
     * @return byte count
     */
    public int bytesFor(Duration duration) {
        long frames = duration.toMillis() * sampleRate / 1000L;
        return Math.toIntExact(frames * blockAlign());
    }

    /** One frame of digital silence. Used as the synthetic keep-alive payload. */
    public byte[] silenceFrame() {
        return new byte[blockAlign()];
    }
}
