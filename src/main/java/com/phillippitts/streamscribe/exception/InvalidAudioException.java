package com.phillippitts.streamscribe.exception;

/**
 * Thrown when an inbound audio request is malformed: missing session id,
 * payload that is not valid base64, or a packet above the configured size cap.
 */
public class InvalidAudioException extends StreamScribeException {

    private final int packetBytes;
    private final String reason;

    public InvalidAudioException(String reason) {
        this(-1, reason);
    }

    /**
     * @param packetBytes size of the offending packet, or -1 when the request carried none
     * @param reason      short caller-facing explanation
     */
    public InvalidAudioException(int packetBytes, String reason) {
        super(packetBytes < 0
                ? "Rejected audio request: " + reason
                : "Rejected audio packet of " + packetBytes + " bytes: " + reason);
        this.packetBytes = packetBytes;
        this.reason = reason;
    }

    public int getPacketBytes() {
        return packetBytes;
    }

    public String getReason() {
        return reason;
    }
}
