package com.phillippitts.streamscribe.exception;

/**
 * Thrown when an operation targets a session id that has no live session.
 */
public class SessionNotFoundException extends StreamScribeException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("No active session: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
