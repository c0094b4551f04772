package com.phillippitts.streamscribe.presentation.exception;

import com.phillippitts.streamscribe.exception.InvalidAudioException;
import com.phillippitts.streamscribe.exception.SessionNotFoundException;
import com.phillippitts.streamscribe.exception.SessionTerminatedException;
import com.phillippitts.streamscribe.exception.UpstreamConnectionExceptionBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void invalidAudioReturns400WithReason() {
        ResponseEntity<?> response = handler.handleInvalidAudio(new InvalidAudioException(0, "audio packet is empty"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString()).contains("InvalidAudioException");
        assertThat(response.getBody().toString()).contains("audio packet is empty");
    }

    @Test
    void unknownSessionReturns404() {
        ResponseEntity<?> response = handler.handleNotFound(new SessionNotFoundException("ghost"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().toString()).contains("ghost");
    }

    @Test
    void endedSessionReturns410() {
        ResponseEntity<?> response = handler.handleTerminated(new SessionTerminatedException("s1", "TERMINATED"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.GONE);
        assertThat(response.getBody().toString()).contains("Reconnect to start a new session");
    }

    @Test
    void upstreamFailureReturns503() {
        ResponseEntity<?> response = handler.handleUpstream(
                UpstreamConnectionExceptionBuilder.create("handshake failed").session("s1").build());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString()).contains("temporarily unavailable");
    }

    @Test
    void unexpectedErrorReturns500WithoutInternals() {
        ResponseEntity<?> response = handler.handleUnexpected(new IllegalStateException("secret detail"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).contains("InternalServerError");
        assertThat(response.getBody().toString()).doesNotContain("secret detail");
    }
}
