package com.phillippitts.streamscribe.presentation.exception;

import com.phillippitts.streamscribe.exception.InvalidAudioException;
import com.phillippitts.streamscribe.exception.SessionNotFoundException;
import com.phillippitts.streamscribe.exception.SessionTerminatedException;
import com.phillippitts.streamscribe.exception.UpstreamConnectionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler(InvalidAudioException.class)
    ResponseEntity<ApiError> handleInvalidAudio(InvalidAudioException ex) {
        LOG.warn("Invalid audio: packetBytes={}, reason={}", ex.getPacketBytes(), ex.getReason());
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(), "Invalid audio request", ex.getReason());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .sorted()
                .collect(Collectors.joining(", "));
        LOG.warn("Rejected request: {}", details);
        return error(HttpStatus.BAD_REQUEST, "ValidationFailed", "Invalid request", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return error(HttpStatus.BAD_REQUEST, "MalformedRequest", "Invalid request", "Request body is not valid JSON");
    }

    /**
     * Unknown session id (HTTP 404).
     */
    @ExceptionHandler(SessionNotFoundException.class)
    ResponseEntity<ApiError> handleNotFound(SessionNotFoundException ex) {
        LOG.info("Unknown session: {}", ex.getSessionId());
        return error(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(), "Session not found", ex.getSessionId());
    }

    /**
     * Session ended while the request was in flight (HTTP 410). The client may start a new one.
     */
    @ExceptionHandler(SessionTerminatedException.class)
    ResponseEntity<ApiError> handleTerminated(SessionTerminatedException ex) {
        LOG.warn("Session {} is no longer accepting audio: state={}", ex.getSessionId(), ex.getState());
        return error(HttpStatus.GONE, ex.getClass().getSimpleName(), "Session has ended",
                "Reconnect to start a new session");
    }

    /**
     * Transient provider error - retry possible (HTTP 503).
     */
    @ExceptionHandler(UpstreamConnectionException.class)
    ResponseEntity<ApiError> handleUpstream(UpstreamConnectionException ex) {
        LOG.error("Upstream connection failed: session={}", ex.getSessionId(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Transcription provider temporarily unavailable", "Please retry in a few seconds");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred", "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
