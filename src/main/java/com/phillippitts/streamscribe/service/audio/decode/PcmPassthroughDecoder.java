package com.phillippitts.streamscribe.service.audio.decode;

import com.phillippitts.streamscribe.exception.AudioDecodeException;
import com.phillippitts.streamscribe.service.audio.AudioFormat;

import java.util.Arrays;

/**
 * Decoder for sources that already send linear PCM (relay clients that decode on-device).
 * Packets must contain whole frames.
 */
public final class PcmPassthroughDecoder extends AbstractFrameDecoder {

    static final String CODEC = "pcm";

    public PcmPassthroughDecoder(AudioFormat format, int maxConsecutiveErrors) {
        super(format, maxConsecutiveErrors);
    }

    @Override
    protected byte[] doDecode(byte[] packet) {
        if (packet.length % format.blockAlign() != 0) {
            throw new AudioDecodeException(CODEC, packet.length,
                    "length is not a multiple of the " + format.blockAlign() + "-byte frame");
        }
        return Arrays.copyOf(packet, packet.length);
    }

    @Override
    protected void resetCodec() {
        // stateless
    }

    @Override
    public String codecName() {
        return CODEC;
    }
}
