package com.phillippitts.streamscribe.service.session;

import com.phillippitts.streamscribe.config.properties.ConnectionProperties;
import com.phillippitts.streamscribe.domain.ConnectionState;
import com.phillippitts.streamscribe.domain.TranscriptFragment;
import com.phillippitts.streamscribe.exception.SessionTerminatedException;
import com.phillippitts.streamscribe.exception.UpstreamConnectionException;
import com.phillippitts.streamscribe.service.metrics.SessionMetrics;
import com.phillippitts.streamscribe.service.upstream.KeepAliveMode;
import com.phillippitts.streamscribe.service.upstream.UpstreamConnection;
import com.phillippitts.streamscribe.service.upstream.UpstreamConnector;
import com.phillippitts.streamscribe.service.upstream.UpstreamListener;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-session connection state machine around a single-use {@link UpstreamConnection}.
 *
 * <pre>
 * IDLE → CONNECTING → OPEN → CLOSING → CLOSED
 * CONNECTING | OPEN → FAILING → BACKOFF → CONNECTING
 *                            ↘ TERMINATED   (attempts &gt; max)
 * </pre>
 *
 * <p><b>Sending:</b> audio is written only in OPEN. Audio arriving in any other live state is
 * queued (bounded by bytes, oldest dropped) and replayed in order once a connection opens.
 * A failed write puts the same payload back at the head of the queue and reconnects
 * immediately; a payload that fails a second time is dropped with a warning.
 *
 * <p><b>Failures:</b> handshake errors, connect timeouts and remote closes increment the
 * consecutive-failure counter and wait {@link BackoffPolicy#delayFor(int)} before the next
 * attempt. A successful open resets the counter. Once the counter exceeds
 * {@code maxReconnectAttempts} the supervisor moves to TERMINATED, cancels everything and
 * reports {@link CloseReason#RECONNECT_BUDGET_EXHAUSTED} to the session.
 *
 * <p><b>Timers:</b> the keep-alive runs at a fixed rate while OPEN. The auto-close timer is
 * re-armed by every genuine audio packet (never by heartbeats) and reports
 * {@link CloseReason#INACTIVITY} on expiry. Every connect attempt, timer and listener carries
 * the generation it was created for; anything that fires for an older generation is ignored,
 * so a shutdown always wins over an in-flight reconnect.
 *
 * <p><b>Thread Safety:</b> state is guarded by one {@link ReentrantLock}. Work that must not
 * run under the lock (dispatching a connect, ending the session, graceful close) is returned
 * from the locked section as a follow-up and run after unlocking. Timers only hand work to the
 * I/O executor; socket writes and closes never run on the shared scheduler threads.
 */
public class ConnectionSupervisor {

    private static final Logger LOG = LogManager.getLogger(ConnectionSupervisor.class);

    private static final Runnable NO_FOLLOW_UP = () -> { };

    private final String sessionId;
    private final UpstreamConnector connector;
    private final TaskScheduler scheduler;
    private final Executor ioExecutor;
    private final Clock clock;
    private final SessionMetrics metrics;
    private final SupervisorCallbacks callbacks;
    private final BackoffPolicy backoff;

    private final Duration connectTimeout;
    private final Duration keepAliveInterval;
    private final KeepAliveMode keepAliveMode;
    private final Duration autoCloseAfter;
    private final int maxAttempts;
    private final int maxPendingBytes;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<OutboundAudio> pending = new ArrayDeque<>();
    private long pendingBytes;
    private long droppedChunks;

    private ConnectionState state = ConnectionState.IDLE;
    private UpstreamConnection connection;
    private int attempts;
    private long generation;
    private long autoCloseGeneration;

    private ScheduledFuture<?> keepAliveTask;
    private ScheduledFuture<?> autoCloseTask;
    private ScheduledFuture<?> reconnectTask;
    private final AtomicBoolean keepAliveInFlight = new AtomicBoolean();

    ConnectionSupervisor(String sessionId,
                         UpstreamConnector connector,
                         ConnectionProperties props,
                         Duration connectTimeout,
                         TaskScheduler scheduler,
                         Executor ioExecutor,
                         Clock clock,
                         SessionMetrics metrics,
                         SupervisorCallbacks callbacks) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.callbacks = Objects.requireNonNull(callbacks, "callbacks");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.backoff = new BackoffPolicy(props.getBackoffBaseMs(), props.getBackoffMultiplier(),
                props.getBackoffCapMs());
        this.keepAliveInterval = Duration.ofMillis(props.getKeepAliveIntervalMs());
        this.keepAliveMode = props.getKeepAliveMode();
        this.autoCloseAfter = Duration.ofMillis(props.getAutoCloseInactivityMs());
        this.maxAttempts = props.getMaxReconnectAttempts();
        this.maxPendingBytes = props.getMaxPendingAudioBytes();
    }

    /**
     * Explicit start: opens the provider connection without waiting for audio and arms
     * the auto-close timer. No-op unless IDLE.
     */
    public void start() {
        Runnable followUp = NO_FOLLOW_UP;
        lock.lock();
        try {
            if (state != ConnectionState.IDLE) {
                return;
            }
            rearmAutoCloseLocked();
            followUp = beginConnectLocked();
        } finally {
            lock.unlock();
        }
        followUp.run();
    }

    /**
     * Forwards one chunk of decoded PCM, in call order.
     *
     * @param pcm genuine audio from the source; re-arms the auto-close timer
     * @throws SessionTerminatedException if the supervisor is closing, closed or terminated
     */
    public void sendAudio(byte[] pcm) {
        Objects.requireNonNull(pcm, "pcm");
        Runnable followUp = NO_FOLLOW_UP;
        lock.lock();
        try {
            if (state.isFinished()) {
                throw new SessionTerminatedException(sessionId, state.name());
            }
            rearmAutoCloseLocked();
            switch (state) {
                case OPEN -> followUp = writeLocked(new OutboundAudio(pcm, false));
                case IDLE -> {
                    enqueueLocked(new OutboundAudio(pcm, false));
                    followUp = beginConnectLocked();
                }
                default -> enqueueLocked(new OutboundAudio(pcm, false));
            }
        } finally {
            lock.unlock();
        }
        followUp.run();
    }

    /**
     * Graceful teardown: cancels timers and any in-flight reconnect, discards queued audio and
     * closes the socket. Idempotent; a TERMINATED supervisor stays TERMINATED.
     */
    public void shutdown(CloseReason reason) {
        UpstreamConnection toClose;
        lock.lock();
        try {
            if (state == ConnectionState.CLOSED || state == ConnectionState.TERMINATED
                    || state == ConnectionState.CLOSING) {
                cancelTimersLocked();
                return;
            }
            state = ConnectionState.CLOSING;
            generation++;
            autoCloseGeneration++;
            cancelTimersLocked();
            discardPendingLocked("session closing (" + reason.tag() + ")");
            toClose = connection;
            connection = null;
        } finally {
            lock.unlock();
        }
        if (toClose != null) {
            toClose.close();
        }
        lock.lock();
        try {
            state = ConnectionState.CLOSED;
        } finally {
            lock.unlock();
        }
        LOG.info("Session {} closed ({})", sessionId, reason.tag());
    }

    public ConnectionState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /** Consecutive connection failures since the last successful open. */
    public int attempts() {
        lock.lock();
        try {
            return attempts;
        } finally {
            lock.unlock();
        }
    }

    /** Bytes of audio waiting for an open connection. */
    public long pendingBytes() {
        lock.lock();
        try {
            return pendingBytes;
        } finally {
            lock.unlock();
        }
    }

    /** Queued chunks discarded because the queue overflowed or a replay failed. */
    public long droppedChunks() {
        lock.lock();
        try {
            return droppedChunks;
        } finally {
            lock.unlock();
        }
    }

    // ---- connect ----

    private Runnable beginConnectLocked() {
        state = ConnectionState.CONNECTING;
        long attemptGeneration = ++generation;
        return () -> dispatchConnect(attemptGeneration);
    }

    private void dispatchConnect(long attemptGeneration) {
        try {
            ioExecutor.execute(() -> runConnect(attemptGeneration));
        } catch (RejectedExecutionException e) {
            onConnectFailed(attemptGeneration, "connect_rejected", e);
        }
    }

    private void runConnect(long attemptGeneration) {
        if (!isCurrent(attemptGeneration, ConnectionState.CONNECTING)) {
            return;
        }
        AttemptListener listener = new AttemptListener(attemptGeneration);
        CompletableFuture<UpstreamConnection> attempt;
        try {
            attempt = connector.connect(sessionId, listener);
        } catch (RuntimeException e) {
            onConnectFailed(attemptGeneration, "connect_failed", e);
            return;
        }
        // timeout fails a copy; a handshake finishing late still reaches onConnected and is closed there
        attempt.thenAccept(conn -> onConnected(listener, conn));
        attempt.copy()
                .orTimeout(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((conn, error) -> {
                    if (error != null) {
                        Throwable cause = unwrap(error);
                        String reason = cause instanceof TimeoutException ? "connect_timeout" : "connect_failed";
                        onConnectFailed(attemptGeneration, reason, cause);
                    }
                });
    }

    private void onConnected(AttemptListener listener, UpstreamConnection conn) {
        Runnable followUp = NO_FOLLOW_UP;
        boolean stale;
        lock.lock();
        try {
            stale = listener.attemptGeneration != generation || state != ConnectionState.CONNECTING;
            if (!stale) {
                listener.adopted = true;
                connection = conn;
                state = ConnectionState.OPEN;
                attempts = 0;
                startKeepAliveLocked();
                LOG.info("Session {} connected to {} ({} queued bytes to replay)",
                        sessionId, connector.providerName(), pendingBytes);
                followUp = drainPendingLocked();
            }
        } finally {
            lock.unlock();
        }
        if (stale) {
            LOG.info("Closing late connection for session {} (attempt no longer current)", sessionId);
            conn.close();
            return;
        }
        followUp.run();
    }

    private void onConnectFailed(long attemptGeneration, String reason, Throwable cause) {
        Runnable followUp;
        lock.lock();
        try {
            if (attemptGeneration != generation || state != ConnectionState.CONNECTING) {
                return;
            }
            LOG.warn("Session {} connect attempt failed ({}): {}", sessionId, reason, describe(cause));
            followUp = failLocked(reason, false);
        } finally {
            lock.unlock();
        }
        followUp.run();
    }

    private void onBackoffElapsed(long backoffGeneration) {
        Runnable followUp;
        lock.lock();
        try {
            if (backoffGeneration != generation || state != ConnectionState.BACKOFF) {
                return;
            }
            reconnectTask = null;
            followUp = beginConnectLocked();
        } finally {
            lock.unlock();
        }
        followUp.run();
    }

    // ---- failure ----

    /**
     * Records one consecutive failure and decides between reconnecting and terminating.
     *
     * @param immediate reconnect without waiting (send failures); otherwise back off
     */
    private Runnable failLocked(String reason, boolean immediate) {
        metrics.connectionFailed(reason);
        state = ConnectionState.FAILING;
        generation++;
        stopKeepAliveLocked();
        if (connection != null) {
            connection.abort();
            connection = null;
        }
        attempts++;
        if (attempts > maxAttempts) {
            return terminateLocked();
        }
        metrics.reconnectAttempted();
        if (immediate) {
            LOG.info("Session {} reconnecting immediately (attempt {}/{})", sessionId, attempts, maxAttempts);
            return beginConnectLocked();
        }
        Duration delay = backoff.delayFor(attempts);
        state = ConnectionState.BACKOFF;
        long backoffGeneration = generation;
        reconnectTask = scheduler.schedule(() -> onBackoffElapsed(backoffGeneration), clock.instant().plus(delay));
        LOG.info("Session {} reconnecting in {} ms (attempt {}/{})",
                sessionId, delay.toMillis(), attempts, maxAttempts);
        return NO_FOLLOW_UP;
    }

    private Runnable terminateLocked() {
        state = ConnectionState.TERMINATED;
        generation++;
        autoCloseGeneration++;
        cancelTimersLocked();
        discardPendingLocked("reconnect budget exhausted");
        LOG.error("Session {} terminated after {} consecutive connection failures", sessionId, attempts);
        return () -> callbacks.onEnded(CloseReason.RECONNECT_BUDGET_EXHAUSTED);
    }

    // ---- sending ----

    private Runnable writeLocked(OutboundAudio chunk) {
        UpstreamConnection conn = connection;
        try {
            conn.sendAudio(chunk.pcm());
            return NO_FOLLOW_UP;
        } catch (UpstreamConnectionException e) {
            LOG.warn("Session {} audio send failed: {}", sessionId, e.getMessage());
            requeueForReplayLocked(chunk);
            // a transport callback may already have handled this connection
            if (state == ConnectionState.OPEN && connection == conn) {
                return failLocked("send_failed", true);
            }
            return NO_FOLLOW_UP;
        }
    }

    private Runnable drainPendingLocked() {
        while (!pending.isEmpty() && state == ConnectionState.OPEN) {
            OutboundAudio chunk = pending.pollFirst();
            pendingBytes -= chunk.pcm().length;
            Runnable followUp = writeLocked(chunk);
            if (followUp != NO_FOLLOW_UP || state != ConnectionState.OPEN) {
                return followUp;
            }
        }
        return NO_FOLLOW_UP;
    }

    private void requeueForReplayLocked(OutboundAudio chunk) {
        if (state.isFinished()) {
            return;
        }
        if (chunk.replayed()) {
            droppedChunks++;
            LOG.warn("Session {} dropping {} bytes of audio after a failed replay", sessionId, chunk.pcm().length);
            return;
        }
        pending.addFirst(new OutboundAudio(chunk.pcm(), true));
        pendingBytes += chunk.pcm().length;
    }

    private void enqueueLocked(OutboundAudio chunk) {
        pending.addLast(chunk);
        pendingBytes += chunk.pcm().length;
        while (pendingBytes > maxPendingBytes && pending.size() > 1) {
            OutboundAudio dropped = pending.pollFirst();
            pendingBytes -= dropped.pcm().length;
            droppedChunks++;
            LOG.warn("Session {} audio queue full while {}; dropped oldest {} bytes",
                    sessionId, state, dropped.pcm().length);
        }
    }

    private void discardPendingLocked(String why) {
        if (!pending.isEmpty()) {
            LOG.warn("Session {} discarding {} queued bytes: {}", sessionId, pendingBytes, why);
            droppedChunks += pending.size();
        }
        pending.clear();
        pendingBytes = 0;
    }

    // ---- timers ----

    private void startKeepAliveLocked() {
        stopKeepAliveLocked();
        long keepAliveGeneration = generation;
        keepAliveTask = scheduler.scheduleAtFixedRate(() -> dispatchKeepAlive(keepAliveGeneration),
                clock.instant().plus(keepAliveInterval), keepAliveInterval);
    }

    /** At most one keep-alive per session is queued or running; a stalled write skips later ticks. */
    private void dispatchKeepAlive(long keepAliveGeneration) {
        if (!keepAliveInFlight.compareAndSet(false, true)) {
            LOG.debug("Session {} keep-alive still in flight; skipping tick", sessionId);
            return;
        }
        try {
            ioExecutor.execute(() -> {
                try {
                    onKeepAlive(keepAliveGeneration);
                } finally {
                    keepAliveInFlight.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            keepAliveInFlight.set(false);
            LOG.warn("Session {} keep-alive skipped: executor saturated", sessionId);
        }
    }

    private void onKeepAlive(long keepAliveGeneration) {
        Runnable followUp = NO_FOLLOW_UP;
        lock.lock();
        try {
            if (keepAliveGeneration != generation || state != ConnectionState.OPEN) {
                return;
            }
            UpstreamConnection conn = connection;
            try {
                conn.sendKeepAlive(keepAliveMode);
            } catch (UpstreamConnectionException e) {
                LOG.warn("Session {} keep-alive failed: {}", sessionId, e.getMessage());
                if (state == ConnectionState.OPEN && connection == conn) {
                    followUp = failLocked("keepalive_failed", false);
                }
            }
        } finally {
            lock.unlock();
        }
        followUp.run();
    }

    private void rearmAutoCloseLocked() {
        if (autoCloseTask != null) {
            autoCloseTask.cancel(false);
        }
        long myGeneration = ++autoCloseGeneration;
        autoCloseTask = scheduler.schedule(() -> dispatchAutoClose(myGeneration), clock.instant().plus(autoCloseAfter));
    }

    private void dispatchAutoClose(long firedGeneration) {
        try {
            ioExecutor.execute(() -> onAutoClose(firedGeneration));
        } catch (RejectedExecutionException e) {
            LOG.warn("Session {} auto-close running on timer thread: executor saturated", sessionId);
            onAutoClose(firedGeneration);
        }
    }

    private void onAutoClose(long firedGeneration) {
        lock.lock();
        try {
            if (firedGeneration != autoCloseGeneration || state.isFinished()) {
                return;
            }
            autoCloseTask = null;
        } finally {
            lock.unlock();
        }
        LOG.info("Session {} idle for {} ms; closing", sessionId, autoCloseAfter.toMillis());
        callbacks.onEnded(CloseReason.INACTIVITY);
    }

    private void stopKeepAliveLocked() {
        if (keepAliveTask != null) {
            keepAliveTask.cancel(false);
            keepAliveTask = null;
        }
    }

    private void cancelTimersLocked() {
        stopKeepAliveLocked();
        if (autoCloseTask != null) {
            autoCloseTask.cancel(false);
            autoCloseTask = null;
        }
        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
    }

    private boolean isCurrent(long expectedGeneration, ConnectionState expectedState) {
        lock.lock();
        try {
            return expectedGeneration == generation && state == expectedState;
        } finally {
            lock.unlock();
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    /**
     * Listener bound to one connect attempt. Lifecycle events from a connection that is no
     * longer current are ignored. Transcripts are forwarded from any connection that was once
     * adopted, so results the provider finalizes while a socket winds down are not lost; a
     * connection that was never adopted (a late handshake) forwards nothing.
     */
    private final class AttemptListener implements UpstreamListener {

        private final long attemptGeneration;
        private volatile boolean adopted;

        private AttemptListener(long attemptGeneration) {
            this.attemptGeneration = attemptGeneration;
        }

        @Override
        public void onTranscript(UpstreamConnection source, TranscriptFragment fragment) {
            if (!adopted) {
                LOG.debug("Session {} ignoring transcript from an unadopted connection", sessionId);
                return;
            }
            callbacks.onTranscript(fragment);
        }

        @Override
        public void onProviderError(UpstreamConnection source, String message) {
            LOG.warn("Session {} provider error (connection kept): {}", sessionId, message);
        }

        @Override
        public void onClosed(UpstreamConnection source, int code, String reason) {
            connectionLost(source, "dropped", "closed " + code + " " + reason);
        }

        @Override
        public void onTransportError(UpstreamConnection source, Throwable error) {
            connectionLost(source, "transport_error", describe(error));
        }

        private void connectionLost(UpstreamConnection source, String reason, String detail) {
            Runnable followUp = NO_FOLLOW_UP;
            lock.lock();
            try {
                if (attemptGeneration == generation && state == ConnectionState.OPEN && connection == source) {
                    LOG.warn("Session {} lost upstream connection: {}", sessionId, detail);
                    followUp = failLocked(reason, false);
                }
            } finally {
                lock.unlock();
            }
            followUp.run();
        }
    }

    private record OutboundAudio(byte[] pcm, boolean replayed) {
    }
}
