package com.phillippitts.streamscribe.domain;

/**
 * Connection state of one transcription session.
 *
 * <pre>
 * IDLE → CONNECTING → OPEN → CLOSING → CLOSED
 *                  ↘        ↘
 *                   FAILING → BACKOFF → CONNECTING
 *                          ↘
 *                           TERMINATED
 * </pre>
 */
public enum ConnectionState {
    IDLE,
    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED,
    FAILING,
    BACKOFF,
    TERMINATED;

    /** True once the session no longer accepts audio. */
    public boolean isFinished() {
        return this == CLOSING || this == CLOSED || this == TERMINATED;
    }

    /** True while the supervisor is recovering a lost connection. */
    public boolean isRecovering() {
        return this == FAILING || this == BACKOFF;
    }
}
