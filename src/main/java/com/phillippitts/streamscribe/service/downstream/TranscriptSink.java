package com.phillippitts.streamscribe.service.downstream;

/**
 * Downstream analysis boundary: receives one finished transcript block per call.
 *
 * <p>Delivery is best-effort. Implementations throw on failure; the caller logs and moves on.
 */
public interface TranscriptSink {

    void deliver(String sessionId, String text);

    /** Sink name for logs. */
    String name();
}
