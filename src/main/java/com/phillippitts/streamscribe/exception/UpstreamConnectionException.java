package com.phillippitts.streamscribe.exception;

/**
 * Thrown when the streaming socket to the STT provider cannot be opened or used:
 * handshake failure, connect timeout, or a send against a closed/broken socket.
 *
 * <p>These errors are transient; the connection supervisor recovers from them with
 * bounded reconnect-with-backoff.
 */
public class UpstreamConnectionException extends StreamScribeException {

    private final String sessionId;

    public UpstreamConnectionException(String message) {
        super(message);
        this.sessionId = "unknown";
    }

    public UpstreamConnectionException(String message, String sessionId) {
        super(message + " (session: " + sessionId + ")");
        this.sessionId = sessionId;
    }

    public UpstreamConnectionException(String message, Throwable cause) {
        super(message, cause);
        this.sessionId = "unknown";
    }

    public UpstreamConnectionException(String message, String sessionId, Throwable cause) {
        super(message + " (session: " + sessionId + ")", cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
