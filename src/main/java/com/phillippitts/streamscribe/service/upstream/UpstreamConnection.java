package com.phillippitts.streamscribe.service.upstream;

import java.time.Instant;

/**
 * One streaming socket to the STT provider.
 *
 * <p>A connection is single-use: once closed or failed it stays that way and the owner
 * must open a new one.
 */
public interface UpstreamConnection {

    String sessionId();

    UpstreamState state();

    /** Last time audio or a keep-alive was written, or a provider message was read. */
    Instant lastActivity();

    /**
     * Forwards a chunk of PCM.
     *
     * @throws com.phillippitts.streamscribe.exception.UpstreamConnectionException if the socket
     *         is not open or the write fails; the connection is FAILED afterwards
     */
    void sendAudio(byte[] pcm);

    /**
     * Writes a heartbeat so the provider does not time the socket out.
     *
     * @throws com.phillippitts.streamscribe.exception.UpstreamConnectionException if the write fails
     */
    void sendKeepAlive(KeepAliveMode mode);

    /** Graceful close: asks the provider to finalize pending results, then closes. Idempotent. */
    void close();

    /** Drops the socket without the graceful handshake. Idempotent. */
    void abort();
}
