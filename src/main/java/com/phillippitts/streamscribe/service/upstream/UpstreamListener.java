package com.phillippitts.streamscribe.service.upstream;

import com.phillippitts.streamscribe.domain.TranscriptFragment;

/**
 * Receives events from one upstream connection. Callbacks arrive on the transport's
 * thread and must not block.
 */
public interface UpstreamListener {

    void onTranscript(UpstreamConnection connection, TranscriptFragment fragment);

    /** Provider reported an application-level error; the socket may stay open. */
    void onProviderError(UpstreamConnection connection, String message);

    /** Socket closed by the remote side or the network, not by {@link UpstreamConnection#close()}. */
    void onClosed(UpstreamConnection connection, int code, String reason);

    void onTransportError(UpstreamConnection connection, Throwable error);
}
