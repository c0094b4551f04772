package com.phillippitts.streamscribe.testutil;

import com.phillippitts.streamscribe.domain.TranscriptFragment;
import com.phillippitts.streamscribe.service.upstream.AbstractUpstreamConnection;
import com.phillippitts.streamscribe.service.upstream.KeepAliveMode;
import com.phillippitts.streamscribe.service.upstream.UpstreamListener;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory upstream connection. Records writes and lets tests inject write failures,
 * remote closes and provider transcripts.
 */
public class FakeUpstreamConnection extends AbstractUpstreamConnection {

    private final UpstreamListener listener;
    private final List<byte[]> sentAudio = new CopyOnWriteArrayList<>();
    private final List<KeepAliveMode> keepAlives = new CopyOnWriteArrayList<>();
    private final AtomicInteger sendFailures = new AtomicInteger();
    private final AtomicInteger keepAliveAttempts = new AtomicInteger();
    private volatile CountDownLatch keepAliveGate;
    private volatile TranscriptFragment emitOnClose;
    private volatile boolean failKeepAlives;
    private volatile boolean closedGracefully;
    private volatile boolean closeCalled;
    private volatile boolean aborted;

    public FakeUpstreamConnection(String sessionId, Clock clock, UpstreamListener listener) {
        super(sessionId, clock);
        this.listener = listener;
    }

    public boolean open() {
        return markOpen();
    }

    /** Makes the next {@code count} audio writes throw. */
    public void failNextSends(int count) {
        sendFailures.set(count);
    }

    public void failKeepAlives(boolean fail) {
        this.failKeepAlives = fail;
    }

    /** Keep-alive writes block until {@code gate} opens, like a stalled socket. */
    public void blockKeepAlives(CountDownLatch gate) {
        this.keepAliveGate = gate;
    }

    /** Delivers {@code fragment} from inside the socket close, as a provider flushing on CloseStream would. */
    public void emitOnClose(TranscriptFragment fragment) {
        this.emitOnClose = fragment;
    }

    public int keepAliveAttempts() {
        return keepAliveAttempts.get();
    }

    /** Remote side drops the socket. */
    public void simulateRemoteClose(int code, String reason) {
        if (markFailed()) {
            listener.onClosed(this, code, reason);
        }
    }

    public void simulateTransportError(Throwable error) {
        if (markFailed()) {
            listener.onTransportError(this, error);
        }
    }

    public void emit(TranscriptFragment fragment) {
        listener.onTranscript(this, fragment);
    }

    public void emitProviderError(String message) {
        listener.onProviderError(this, message);
    }

    public List<byte[]> sentAudio() {
        return List.copyOf(sentAudio);
    }

    public List<KeepAliveMode> keepAlives() {
        return List.copyOf(keepAlives);
    }

    public boolean closedGracefully() {
        return closedGracefully;
    }

    public boolean closeCalled() {
        return closeCalled;
    }

    public boolean aborted() {
        return aborted;
    }

    @Override
    protected void doSendAudio(byte[] pcm) throws IOException {
        if (sendFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new IOException("simulated write failure");
        }
        sentAudio.add(pcm.clone());
    }

    @Override
    protected void doSendKeepAlive(KeepAliveMode mode) throws IOException {
        keepAliveAttempts.incrementAndGet();
        CountDownLatch gate = keepAliveGate;
        if (gate != null) {
            try {
                gate.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("keep-alive interrupted", e);
            }
        }
        if (failKeepAlives) {
            throw new IOException("simulated keep-alive failure");
        }
        keepAlives.add(mode);
    }

    @Override
    protected void doClose(boolean graceful) {
        closeCalled = true;
        closedGracefully = graceful;
        TranscriptFragment last = emitOnClose;
        if (last != null) {
            listener.onTranscript(this, last);
        }
    }

    @Override
    protected void doAbort() {
        aborted = true;
    }
}
