package com.phillippitts.streamscribe.service.upstream.deepgram;

import com.phillippitts.streamscribe.domain.TranscriptFragment;

/**
 * One parsed message from the provider socket.
 */
interface ProviderEvent {

    /** A transcript result carrying non-blank text. */
    record Transcript(TranscriptFragment fragment) implements ProviderEvent {
    }

    /** An application-level error reported by the provider. */
    record ProviderError(String message) implements ProviderEvent {
    }

    /** Metadata, speech markers, empty results or anything unrecognized. */
    record Ignored(String type) implements ProviderEvent {
    }
}
