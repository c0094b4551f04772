package com.phillippitts.streamscribe.service.transcript;

import java.util.Locale;

/**
 * Result of offering a fragment to a {@link TranscriptAccumulator}.
 */
public enum AcceptOutcome {
    ACCEPTED,
    /** Too similar to a recently accepted fragment. */
    DUPLICATE,
    /** Interim results never mutate the buffer. */
    INTERIM_IGNORED,
    /** The accumulator has already been closed. */
    REJECTED_CLOSED;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
