package com.phillippitts.streamscribe.service.transcript;

import java.util.Locale;

/**
 * Why a transcript block was released.
 */
public enum FlushTrigger {
    /** The dwell period elapsed without a new final fragment. */
    INACTIVITY,
    /** A caller asked for an immediate flush. */
    FORCED,
    /** The session is being torn down. */
    TEARDOWN;

    /** Lower-case tag value for metrics and logs. */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
