package com.phillippitts.streamscribe.service.audio.decode;

import com.phillippitts.streamscribe.exception.AudioDecodeException;
import com.phillippitts.streamscribe.service.audio.AudioFormat;

/**
 * Decodes compressed audio packets from one source into linear PCM.
 *
 * <p>Implementations are stateful (the codec carries state across packets), so one instance
 * belongs to exactly one session. A failed packet must leave the decoder usable for the
 * next packet.
 */
public interface AudioFrameDecoder extends AutoCloseable {

    /**
     * Decodes one packet.
     *
     * @param packet compressed packet as received from the source
     * @return little-endian PCM in {@link #outputFormat()}; empty when the packet carried no audio
     * @throws AudioDecodeException if this packet cannot be decoded
     */
    byte[] decode(byte[] packet);

    /** Format of the PCM returned by {@link #decode(byte[])}. */
    AudioFormat outputFormat();

    /** Codec name for logging and metrics (e.g., "opus", "pcm"). */
    String codecName();

    /** Number of packets dropped because they failed to decode. */
    long failedPackets();

    @Override
    void close();
}
