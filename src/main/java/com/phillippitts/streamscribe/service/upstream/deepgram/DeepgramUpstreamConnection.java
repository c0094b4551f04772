package com.phillippitts.streamscribe.service.upstream.deepgram;

import com.phillippitts.streamscribe.service.audio.AudioFormat;
import com.phillippitts.streamscribe.service.upstream.AbstractUpstreamConnection;
import com.phillippitts.streamscribe.service.upstream.KeepAliveMode;
import com.phillippitts.streamscribe.service.upstream.UpstreamListener;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import java.io.IOException;
import java.time.Clock;

/**
 * Deepgram live-transcription socket.
 *
 * <p>Audio goes out as binary frames; the keep-alive is either a frame of silence or the
 * {@code {"type":"KeepAlive"}} control message. A graceful close sends
 * {@code {"type":"CloseStream"}} and then closes the socket with 1000 right away; results the
 * provider finalizes after {@code CloseStream} are not waited for.
 */
final class DeepgramUpstreamConnection extends AbstractUpstreamConnection {

    private static final Logger LOG = LogManager.getLogger(DeepgramUpstreamConnection.class);

    static final String KEEP_ALIVE_MESSAGE = "{\"type\":\"KeepAlive\"}";
    static final String CLOSE_STREAM_MESSAGE = "{\"type\":\"CloseStream\"}";

    private final UpstreamListener listener;
    private final byte[] silence;
    private final Handler handler = new Handler();
    private volatile WebSocketSession socket;

    DeepgramUpstreamConnection(String sessionId, AudioFormat format, UpstreamListener listener, Clock clock) {
        super(sessionId, clock);
        this.listener = listener;
        this.silence = format.silenceFrame();
    }

    /** Socket handler bound to this connection. */
    AbstractWebSocketHandler handler() {
        return handler;
    }

    @Override
    protected void doSendAudio(byte[] pcm) throws IOException {
        socket.sendMessage(new BinaryMessage(pcm));
    }

    @Override
    protected void doSendKeepAlive(KeepAliveMode mode) throws IOException {
        if (mode.sendsSilence()) {
            socket.sendMessage(new BinaryMessage(silence));
        }
        if (mode.sendsControl()) {
            socket.sendMessage(new TextMessage(KEEP_ALIVE_MESSAGE));
        }
    }

    @Override
    protected void doClose(boolean graceful) throws IOException {
        WebSocketSession s = socket;
        if (s == null || !s.isOpen()) {
            return;
        }
        if (graceful) {
            s.sendMessage(new TextMessage(CLOSE_STREAM_MESSAGE));
        }
        s.close(CloseStatus.NORMAL);
    }

    @Override
    protected void doAbort() throws IOException {
        WebSocketSession s = socket;
        if (s != null && s.isOpen()) {
            s.close(CloseStatus.GOING_AWAY);
        }
    }

    private final class Handler extends AbstractWebSocketHandler {

        @Override
        public void afterConnectionEstablished(WebSocketSession session) {
            socket = session;
            markOpen();
            LOG.info("Upstream socket open for session {}", sessionId);
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            touch();
            ProviderEvent event = DeepgramEventParser.parse(message.getPayload(), clock.instant());
            if (event instanceof ProviderEvent.Transcript t) {
                listener.onTranscript(DeepgramUpstreamConnection.this, t.fragment());
            } else if (event instanceof ProviderEvent.ProviderError e) {
                listener.onProviderError(DeepgramUpstreamConnection.this, e.message());
            } else {
                LOG.trace("Ignoring provider message for session {}: {}", sessionId, event);
            }
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            if (markFailed()) {
                LOG.warn("Upstream transport error for session {}: {}", sessionId, exception.toString());
                listener.onTransportError(DeepgramUpstreamConnection.this, exception);
            }
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            // Only a close we did not initiate is reported
            if (markFailed()) {
                LOG.warn("Upstream socket for session {} closed remotely: {} {}",
                        sessionId, status.getCode(), status.getReason());
                listener.onClosed(DeepgramUpstreamConnection.this, status.getCode(), status.getReason());
            } else {
                LOG.debug("Upstream socket for session {} closed: {}", sessionId, status.getCode());
            }
        }
    }
}
