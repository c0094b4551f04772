package com.phillippitts.streamscribe.config.properties;

import com.phillippitts.streamscribe.service.audio.AudioFormat;
import com.phillippitts.streamscribe.service.audio.decode.AudioCodec;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Inbound audio format and decoder tuning.
 *
 * <p>The decoded PCM format is also the format announced to the STT provider, so
 * {@code sample-rate}, {@code channels} and {@code bits-per-sample} must match what the
 * device records.
 *
 * <p>Note: Bean created via {@link com.phillippitts.streamscribe.StreamScribeApplication}'s
 * {@code @EnableConfigurationProperties}.
 */
@ConfigurationProperties(prefix = "stream.audio")
@Validated
public class AudioStreamProperties {

    /** Codec of inbound packets. */
    @NotNull
    private AudioCodec codec = AudioCodec.OPUS;

    @Positive(message = "Sample rate must be positive")
    private int sampleRate = 16_000;

    @Min(1)
    @Max(2)
    private int channels = 1;

    @Positive(message = "Bits per sample must be positive")
    private int bitsPerSample = 16;

    /** Device header bytes (packet index + sub-index) stripped before Opus decoding. */
    @Min(0)
    private int packetHeaderBytes = 3;

    /** Samples per channel in one Opus frame (60 ms at 16 kHz). */
    @Positive
    private int opusFrameSamples = 960;

    /** Consecutive decode failures after which the codec state is recreated. */
    @Positive
    private int maxConsecutiveDecodeErrors = 5;

    /** Upper bound for a single inbound packet (security cap). */
    @Positive(message = "Maximum packet size must be positive")
    private int maxPacketBytes = 1024 * 1024;  // 1 MB

    public AudioFormat toAudioFormat() {
        return new AudioFormat(sampleRate, channels, bitsPerSample);
    }

    public AudioCodec getCodec() {
        return codec;
    }

    public void setCodec(AudioCodec codec) {
        this.codec = codec;
    }

    public int getSampleRate() {
        return sampleRate;
    }

    public void setSampleRate(int sampleRate) {
        this.sampleRate = sampleRate;
    }

    public int getChannels() {
        return channels;
    }

    public void setChannels(int channels) {
        this.channels = channels;
    }

    public int getBitsPerSample() {
        return bitsPerSample;
    }

    public void setBitsPerSample(int bitsPerSample) {
        this.bitsPerSample = bitsPerSample;
    }

    public int getPacketHeaderBytes() {
        return packetHeaderBytes;
    }

    public void setPacketHeaderBytes(int packetHeaderBytes) {
        this.packetHeaderBytes = packetHeaderBytes;
    }

    public int getOpusFrameSamples() {
        return opusFrameSamples;
    }

    public void setOpusFrameSamples(int opusFrameSamples) {
        this.opusFrameSamples = opusFrameSamples;
    }

    public int getMaxConsecutiveDecodeErrors() {
        return maxConsecutiveDecodeErrors;
    }

    public void setMaxConsecutiveDecodeErrors(int maxConsecutiveDecodeErrors) {
        this.maxConsecutiveDecodeErrors = maxConsecutiveDecodeErrors;
    }

    public int getMaxPacketBytes() {
        return maxPacketBytes;
    }

    public void setMaxPacketBytes(int maxPacketBytes) {
        this.maxPacketBytes = maxPacketBytes;
    }
}
