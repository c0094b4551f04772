package com.phillippitts.streamscribe.exception;

/**
 * Thrown when a single compressed audio packet cannot be decoded.
 *
 * <p>Decode failures are per-packet: the session glue logs them and drops the packet,
 * the stream continues with the next one.
 */
public class AudioDecodeException extends StreamScribeException {

    private final String codec;
    private final int packetSize;

    public AudioDecodeException(String codec, int packetSize, String message) {
        super(codec + " decode failed (" + packetSize + " bytes): " + message);
        this.codec = codec;
        this.packetSize = packetSize;
    }

    public AudioDecodeException(String codec, int packetSize, String message, Throwable cause) {
        super(codec + " decode failed (" + packetSize + " bytes): " + message, cause);
        this.codec = codec;
        this.packetSize = packetSize;
    }

    public String getCodec() {
        return codec;
    }

    public int getPacketSize() {
        return packetSize;
    }
}
