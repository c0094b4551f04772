package com.phillippitts.streamscribe.service.transcript;

/**
 * Receives non-empty transcript blocks released by a {@link TranscriptAccumulator}.
 * Called outside the accumulator's lock; exceptions are logged by the caller and never
 * re-buffer the text.
 */
@FunctionalInterface
public interface FlushHandler {

    void onFlush(String sessionId, String text, FlushTrigger trigger);
}
