package com.phillippitts.streamscribe.service.upstream;

import com.phillippitts.streamscribe.exception.UpstreamConnectionException;
import com.phillippitts.streamscribe.exception.UpstreamConnectionExceptionBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Base class for upstream connections providing monotonic state and write error handling.
 *
 * <p>This class implements the Template Method pattern: {@link #sendAudio(byte[])},
 * {@link #sendKeepAlive(KeepAliveMode)}, {@link #close()} and {@link #abort()} check and
 * advance the state under {@link #lock}, then call the transport hooks. Any
 * {@link IOException} from a hook moves the connection to {@link UpstreamState#FAILED}
 * and is rethrown as {@link UpstreamConnectionException}.
 *
 * <p><b>Thread Safety:</b> writes are serialized on {@link #lock}; the underlying socket
 * never sees two concurrent frames.
 */
public abstract class AbstractUpstreamConnection implements UpstreamConnection {

    private static final Logger LOG = LogManager.getLogger(AbstractUpstreamConnection.class);

    protected final Object lock = new Object();
    protected final String sessionId;
    protected final Clock clock;

    private UpstreamState state = UpstreamState.CONNECTING;
    private volatile Instant lastActivity;

    protected AbstractUpstreamConnection(String sessionId, Clock clock) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.lastActivity = clock.instant();
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public UpstreamState state() {
        synchronized (lock) {
            return state;
        }
    }

    @Override
    public Instant lastActivity() {
        return lastActivity;
    }

    @Override
    public final void sendAudio(byte[] pcm) {
        Objects.requireNonNull(pcm, "pcm");
        synchronized (lock) {
            ensureOpen("send audio");
            try {
                doSendAudio(pcm);
                touch();
            } catch (IOException | RuntimeException e) {
                state = UpstreamState.FAILED;
                throw writeFailure("Audio write failed", e, pcm.length);
            }
        }
    }

    @Override
    public final void sendKeepAlive(KeepAliveMode mode) {
        Objects.requireNonNull(mode, "mode");
        synchronized (lock) {
            ensureOpen("send keep-alive");
            try {
                doSendKeepAlive(mode);
                touch();
            } catch (IOException | RuntimeException e) {
                state = UpstreamState.FAILED;
                throw writeFailure("Keep-alive write failed", e, -1);
            }
        }
    }

    @Override
    public final void close() {
        synchronized (lock) {
            if (state.isTerminal()) {
                return;
            }
            boolean wasOpen = state == UpstreamState.OPEN;
            state = UpstreamState.CLOSED;
            try {
                doClose(wasOpen);
            } catch (IOException | RuntimeException e) {
                LOG.debug("Error closing upstream socket for session {}: {}", sessionId, e.toString());
            }
        }
    }

    @Override
    public final void abort() {
        synchronized (lock) {
            if (state.isTerminal()) {
                return;
            }
            state = UpstreamState.FAILED;
            try {
                doAbort();
            } catch (IOException | RuntimeException e) {
                LOG.debug("Error aborting upstream socket for session {}: {}", sessionId, e.toString());
            }
        }
    }

    /**
     * Marks the connection open. Only valid from CONNECTING.
     *
     * @return true if the state changed
     */
    protected final boolean markOpen() {
        synchronized (lock) {
            if (state != UpstreamState.CONNECTING) {
                return false;
            }
            state = UpstreamState.OPEN;
            touch();
            return true;
        }
    }

    /**
     * Records a transport-level loss of the socket.
     *
     * @return true if this call moved the connection to FAILED, false if it was already terminal
     */
    protected final boolean markFailed() {
        synchronized (lock) {
            if (state.isTerminal()) {
                return false;
            }
            state = UpstreamState.FAILED;
            return true;
        }
    }

    /** Records inbound traffic from the provider. */
    protected final void touch() {
        lastActivity = clock.instant();
    }

    protected abstract void doSendAudio(byte[] pcm) throws IOException;

    protected abstract void doSendKeepAlive(KeepAliveMode mode) throws IOException;

    /**
     * Transport close. Called once, under {@link #lock}.
     *
     * @param graceful true when the socket was open and the provider should finalize results
     */
    protected abstract void doClose(boolean graceful) throws IOException;

    protected abstract void doAbort() throws IOException;

    private void ensureOpen(String operation) {
        if (state != UpstreamState.OPEN) {
            throw UpstreamConnectionExceptionBuilder.create("Cannot " + operation + " on upstream socket")
                    .session(sessionId)
                    .metadata("state", state)
                    .build();
        }
    }

    private UpstreamConnectionException writeFailure(String message, Exception e, int bytes) {
        UpstreamConnectionExceptionBuilder builder = UpstreamConnectionExceptionBuilder.create(message)
                .session(sessionId)
                .cause(e);
        if (bytes >= 0) {
            builder.metadata("bytes", bytes);
        }
        return builder.build();
    }
}
