package com.phillippitts.streamscribe.service.upstream;

import java.util.concurrent.CompletableFuture;

/**
 * Opens streaming connections to the STT provider.
 */
public interface UpstreamConnector {

    /**
     * Starts opening a connection.
     *
     * @param sessionId session the connection belongs to
     * @param listener  receives transcripts and lifecycle events for this connection only
     * @return future completed with an OPEN connection, or exceptionally with
     *         {@link com.phillippitts.streamscribe.exception.UpstreamConnectionException}
     */
    CompletableFuture<UpstreamConnection> connect(String sessionId, UpstreamListener listener);

    /** Provider name for logs and health output. */
    String providerName();
}
