package com.phillippitts.streamscribe.service.audio.decode;

import com.phillippitts.streamscribe.exception.AudioDecodeException;
import com.phillippitts.streamscribe.service.audio.AudioFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Base class for packet decoders providing error accounting and codec-state recovery.
 *
 * <p>{@link #decode(byte[])} is a template method: it delegates to {@link #doDecode(byte[])},
 * counts consecutive failures and, once {@code maxConsecutiveErrors} packets in a row have
 * failed, calls {@link #resetCodec()} so a wedged codec state cannot poison the rest of the
 * stream. A successful packet resets the counter.
 *
 * <p><b>Thread Safety:</b> decode calls are serialized on an internal lock. Packets of one
 * session arrive in order, so contention is not expected.
 */
public abstract class AbstractFrameDecoder implements AudioFrameDecoder {

    private static final Logger LOG = LogManager.getLogger(AbstractFrameDecoder.class);

    protected static final byte[] NO_AUDIO = new byte[0];

    protected final Object lock = new Object();
    protected final AudioFormat format;
    private final int maxConsecutiveErrors;

    private int consecutiveErrors;
    private long failedPackets;
    private boolean closed;

    protected AbstractFrameDecoder(AudioFormat format, int maxConsecutiveErrors) {
        this.format = Objects.requireNonNull(format, "format");
        if (maxConsecutiveErrors <= 0) {
            throw new IllegalArgumentException("maxConsecutiveErrors must be positive");
        }
        this.maxConsecutiveErrors = maxConsecutiveErrors;
    }

    @Override
    public final byte[] decode(byte[] packet) {
        if (packet == null) {
            throw new AudioDecodeException(codecName(), 0, "packet is null");
        }
        synchronized (lock) {
            if (closed) {
                throw new AudioDecodeException(codecName(), packet.length, "decoder closed");
            }
            try {
                byte[] pcm = doDecode(packet);
                consecutiveErrors = 0;
                return pcm;
            } catch (AudioDecodeException e) {
                recordFailure();
                throw e;
            } catch (RuntimeException e) {
                recordFailure();
                throw new AudioDecodeException(codecName(), packet.length, e.getMessage(), e);
            }
        }
    }

    /**
     * Codec-specific decode of one packet. Called under {@link #lock}.
     *
     * @param packet raw packet (never null)
     * @return PCM bytes, or {@link #NO_AUDIO} for packets that carry no audio
     * @throws AudioDecodeException if the packet is corrupt
     */
    protected abstract byte[] doDecode(byte[] packet);

    /**
     * Discards codec state and starts fresh. Called under {@link #lock} after too many
     * consecutive failures. Implementations without state may do nothing.
     */
    protected abstract void resetCodec();

    @Override
    public AudioFormat outputFormat() {
        return format;
    }

    @Override
    public long failedPackets() {
        synchronized (lock) {
            return failedPackets;
        }
    }

    /** Visible for tests */
    int consecutiveErrors() {
        synchronized (lock) {
            return consecutiveErrors;
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            closed = true;
        }
    }

    private void recordFailure() {
        failedPackets++;
        consecutiveErrors++;
        if (consecutiveErrors >= maxConsecutiveErrors) {
            LOG.warn("{} decoder hit {} consecutive errors; resetting codec state", codecName(), consecutiveErrors);
            try {
                resetCodec();
            } catch (RuntimeException e) {
                LOG.error("Failed to reset {} decoder: {}", codecName(), e.toString());
            }
            consecutiveErrors = 0;
        }
    }
}
