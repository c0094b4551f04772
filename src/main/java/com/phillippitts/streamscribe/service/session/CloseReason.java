package com.phillippitts.streamscribe.service.session;

import java.util.Locale;

/**
 * Why a session was torn down.
 */
public enum CloseReason {
    /** The caller disconnected or asked for the session to end. */
    CLIENT_DISCONNECT,
    /** No genuine audio arrived within the auto-close window. */
    INACTIVITY,
    /** Consecutive connection failures exceeded the reconnect budget. */
    RECONNECT_BUDGET_EXHAUSTED,
    /** Evicted by the health sweep. */
    STALE,
    /** Application shutdown. */
    SHUTDOWN;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
