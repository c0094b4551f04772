package com.phillippitts.streamscribe.service.upstream;

/**
 * Transport state of one upstream socket. Transitions are monotonic:
 * {@code CONNECTING → OPEN → (CLOSED | FAILED)}; a socket never reopens.
 */
public enum UpstreamState {
    CONNECTING,
    OPEN,
    CLOSED,
    FAILED;

    public boolean isTerminal() {
        return this == CLOSED || this == FAILED;
    }
}
