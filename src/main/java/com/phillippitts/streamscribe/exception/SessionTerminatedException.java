package com.phillippitts.streamscribe.exception;

/**
 * Thrown when audio is addressed to a session that has already closed or exhausted its
 * reconnect budget. The caller must start a new session.
 */
public class SessionTerminatedException extends StreamScribeException {

    private final String sessionId;
    private final String state;

    public SessionTerminatedException(String sessionId, String state) {
        super("Session " + sessionId + " is no longer accepting audio (state: " + state + ")");
        this.sessionId = sessionId;
        this.state = state;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getState() {
        return state;
    }
}
