package com.phillippitts.streamscribe.presentation.websocket;

import com.phillippitts.streamscribe.exception.InvalidAudioException;
import com.phillippitts.streamscribe.exception.SessionNotFoundException;
import com.phillippitts.streamscribe.service.session.TranscriptionSessionService;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.BinaryWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Device audio over WebSocket: one compressed packet per binary frame.
 *
 * <p>The session id comes from the {@code sessionId} query parameter. Closing the socket
 * disconnects the transcription session, which performs the final flush.
 */
public class AudioStreamWebSocketHandler extends BinaryWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(AudioStreamWebSocketHandler.class);

    static final String SESSION_ID_PARAM = "sessionId";
    static final String SESSION_ID_ATTRIBUTE = "streamscribe.sessionId";

    private final TranscriptionSessionService sessionService;

    public AudioStreamWebSocketHandler(TranscriptionSessionService sessionService) {
        this.sessionService = Objects.requireNonNull(sessionService, "sessionService");
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession socket) throws Exception {
        String sessionId = sessionIdFrom(socket.getUri());
        if (sessionId == null) {
            LOG.warn("Rejecting audio socket {} without a sessionId parameter", socket.getId());
            socket.close(CloseStatus.POLICY_VIOLATION.withReason("sessionId query parameter is required"));
            return;
        }
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put("sessionId", sessionId)) {
            sessionService.connect(sessionId);
            socket.getAttributes().put(SESSION_ID_ATTRIBUTE, sessionId);
            LOG.info("Audio socket {} attached", socket.getId());
        } catch (InvalidAudioException e) {
            LOG.warn("Rejecting audio socket {}: {}", socket.getId(), e.getReason());
            socket.close(CloseStatus.POLICY_VIOLATION.withReason(e.getReason()));
        }
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession socket, BinaryMessage message) {
        String sessionId = (String) socket.getAttributes().get(SESSION_ID_ATTRIBUTE);
        if (sessionId == null) {
            return;
        }
        ByteBuffer payload = message.getPayload();
        byte[] packet = new byte[payload.remaining()];
        payload.get(packet);
        try {
            sessionService.processAudio(sessionId, packet);
        } catch (InvalidAudioException e) {
            LOG.warn("Dropping audio frame on socket {}: {}", socket.getId(), e.getReason());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession socket, Throwable exception) {
        LOG.warn("Transport error on audio socket {}: {}", socket.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession socket, CloseStatus status) {
        String sessionId = (String) socket.getAttributes().remove(SESSION_ID_ATTRIBUTE);
        if (sessionId == null) {
            return;
        }
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put("sessionId", sessionId)) {
            sessionService.disconnect(sessionId);
            LOG.info("Audio socket {} closed ({}); session disconnected", socket.getId(), status.getCode());
        } catch (SessionNotFoundException e) {
            LOG.debug("Audio socket {} closed after session {} had already ended", socket.getId(), sessionId);
        }
    }

    static String sessionIdFrom(URI uri) {
        if (uri == null) {
            return null;
        }
        String value = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst(SESSION_ID_PARAM);
        if (value == null || value.isBlank()) {
            return null;
        }
        return UriUtils.decode(value, StandardCharsets.UTF_8).trim();
    }
}
