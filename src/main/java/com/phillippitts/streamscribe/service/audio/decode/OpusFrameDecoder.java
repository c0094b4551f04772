package com.phillippitts.streamscribe.service.audio.decode;

import com.phillippitts.streamscribe.exception.AudioDecodeException;
import com.phillippitts.streamscribe.service.audio.AudioFormat;
import io.github.jaredmdobson.concentus.OpusDecoder;
import io.github.jaredmdobson.concentus.OpusException;

/**
 * Decodes Opus packets from the BLE pendant into 16-bit little-endian PCM.
 *
 * <p>Each packet starts with a fixed-size device header (packet index and sub-index)
 * that is stripped before decoding. Packets no longer than the header carry no audio
 * and yield an empty result.
 */
public final class OpusFrameDecoder extends AbstractFrameDecoder {

    static final String CODEC = "opus";

    private final int headerBytes;
    private final int frameSamples;
    private final short[] pcmBuffer;
    private OpusDecoder decoder;

    /**
     * @param format               output format; Opus only supports 8/12/16/24/48 kHz and 1-2 channels
     * @param headerBytes          device header length stripped from every packet
     * @param frameSamples         maximum samples per channel one packet may decode to
     * @param maxConsecutiveErrors failures in a row before the codec state is recreated
     */
    public OpusFrameDecoder(AudioFormat format, int headerBytes, int frameSamples, int maxConsecutiveErrors) {
        super(format, maxConsecutiveErrors);
        if (format.bitsPerSample() != 16) {
            throw new IllegalArgumentException("Opus decoder produces 16-bit PCM only");
        }
        if (headerBytes < 0) {
            throw new IllegalArgumentException("headerBytes must not be negative");
        }
        if (frameSamples <= 0) {
            throw new IllegalArgumentException("frameSamples must be positive");
        }
        this.headerBytes = headerBytes;
        this.frameSamples = frameSamples;
        this.pcmBuffer = new short[frameSamples * format.channels()];
        this.decoder = newDecoder();
    }

    @Override
    protected byte[] doDecode(byte[] packet) {
        if (packet.length <= headerBytes) {
            return NO_AUDIO;
        }
        int samplesPerChannel;
        try {
            samplesPerChannel = decoder.decode(packet, headerBytes, packet.length - headerBytes,
                    pcmBuffer, 0, frameSamples, false);
        } catch (OpusException e) {
            throw new AudioDecodeException(CODEC, packet.length, e.getMessage(), e);
        }
        if (samplesPerChannel <= 0) {
            return NO_AUDIO;
        }
        int samples = samplesPerChannel * format.channels();
        byte[] out = new byte[samples * 2];
        for (int i = 0; i < samples; i++) {
            short s = pcmBuffer[i];
            out[2 * i] = (byte) (s & 0xFF);
            out[2 * i + 1] = (byte) ((s >>> 8) & 0xFF);
        }
        return out;
    }

    @Override
    protected void resetCodec() {
        decoder = newDecoder();
    }

    @Override
    public String codecName() {
        return CODEC;
    }

    private OpusDecoder newDecoder() {
        try {
            return new OpusDecoder(format.sampleRate(), format.channels());
        } catch (OpusException e) {
            throw new IllegalStateException("Cannot create Opus decoder for " + format, e);
        }
    }
}
