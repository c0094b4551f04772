package com.phillippitts.streamscribe.presentation.websocket;

import com.phillippitts.streamscribe.exception.InvalidAudioException;
import com.phillippitts.streamscribe.exception.SessionNotFoundException;
import com.phillippitts.streamscribe.service.session.TranscriptionSessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AudioStreamWebSocketHandlerTest {

    private TranscriptionSessionService service;
    private AudioStreamWebSocketHandler handler;
    private WebSocketSession socket;
    private Map<String, Object> attributes;

    @BeforeEach
    void setUp() {
        service = mock(TranscriptionSessionService.class);
        handler = new AudioStreamWebSocketHandler(service);
        socket = mock(WebSocketSession.class);
        attributes = new HashMap<>();
        when(socket.getAttributes()).thenReturn(attributes);
        when(socket.getId()).thenReturn("ws-1");
    }

    @Test
    void readsSessionIdFromQuery() {
        assertThat(AudioStreamWebSocketHandler.sessionIdFrom(URI.create("ws://host/stream/ws?sessionId=device-1")))
                .isEqualTo("device-1");
        assertThat(AudioStreamWebSocketHandler.sessionIdFrom(URI.create("ws://host/stream/ws?sessionId=a%20b&x=1")))
                .isEqualTo("a b");
        assertThat(AudioStreamWebSocketHandler.sessionIdFrom(URI.create("ws://host/stream/ws?sessionId=")))
                .isNull();
        assertThat(AudioStreamWebSocketHandler.sessionIdFrom(URI.create("ws://host/stream/ws"))).isNull();
        assertThat(AudioStreamWebSocketHandler.sessionIdFrom(null)).isNull();
    }

    @Test
    void attachesSessionOnConnect() throws Exception {
        when(socket.getUri()).thenReturn(URI.create("ws://host/stream/ws?sessionId=device-1"));

        handler.afterConnectionEstablished(socket);

        verify(service).connect("device-1");
        assertThat(attributes).containsEntry(AudioStreamWebSocketHandler.SESSION_ID_ATTRIBUTE, "device-1");
        verify(socket, never()).close(any(CloseStatus.class));
    }

    @Test
    void rejectsSocketWithoutSessionId() throws Exception {
        when(socket.getUri()).thenReturn(URI.create("ws://host/stream/ws"));

        handler.afterConnectionEstablished(socket);

        verify(socket).close(argThat((CloseStatus s) -> s.getCode() == CloseStatus.POLICY_VIOLATION.getCode()));
        verify(service, never()).connect(anyString());
    }

    @Test
    void rejectsSocketWithInvalidSessionId() throws Exception {
        when(socket.getUri()).thenReturn(URI.create("ws://host/stream/ws?sessionId=bad"));
        when(service.connect("bad")).thenThrow(new InvalidAudioException("sessionId exceeds 128 characters"));

        handler.afterConnectionEstablished(socket);

        verify(socket).close(argThat((CloseStatus s) -> s.getCode() == CloseStatus.POLICY_VIOLATION.getCode()));
        assertThat(attributes).isEmpty();
    }

    @Test
    void forwardsBinaryFramesToSession() throws Exception {
        attributes.put(AudioStreamWebSocketHandler.SESSION_ID_ATTRIBUTE, "device-1");

        handler.handleMessage(socket, new BinaryMessage(new byte[]{1, 2, 3, 4}));

        verify(service).processAudio("device-1", new byte[]{1, 2, 3, 4});
    }

    @Test
    void invalidFrameDoesNotCloseSocket() throws Exception {
        attributes.put(AudioStreamWebSocketHandler.SESSION_ID_ATTRIBUTE, "device-1");
        doThrow(new InvalidAudioException(0, "audio packet is empty"))
                .when(service).processAudio(anyString(), any());

        assertThatCode(() -> handler.handleMessage(socket, new BinaryMessage(new byte[0])))
                .doesNotThrowAnyException();
        verify(socket, never()).close(any(CloseStatus.class));
    }

    @Test
    void closingSocketDisconnectsSession() {
        attributes.put(AudioStreamWebSocketHandler.SESSION_ID_ATTRIBUTE, "device-1");

        handler.afterConnectionClosed(socket, CloseStatus.NORMAL);

        verify(service).disconnect("device-1");
        assertThat(attributes).isEmpty();
    }

    @Test
    void closingAfterSessionEndedIsQuiet() {
        attributes.put(AudioStreamWebSocketHandler.SESSION_ID_ATTRIBUTE, "device-1");
        doThrow(new SessionNotFoundException("device-1")).when(service).disconnect("device-1");

        assertThatCode(() -> handler.afterConnectionClosed(socket, CloseStatus.GOING_AWAY))
                .doesNotThrowAnyException();
    }

    @Test
    void unattachedSocketCloseIsIgnored() {
        handler.afterConnectionClosed(socket, CloseStatus.NORMAL);

        verify(service, never()).disconnect(anyString());
    }
}
