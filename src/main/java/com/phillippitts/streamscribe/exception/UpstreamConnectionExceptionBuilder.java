package com.phillippitts.streamscribe.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link UpstreamConnectionException} with contextual detail.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw UpstreamConnectionExceptionBuilder.create("Provider handshake timed out")
 *         .session(sessionId)
 *         .attempt(3)
 *         .durationMs(10_000)
 *         .metadata("url", providerUrl)
 *         .build();
 * </pre>
 */
public final class UpstreamConnectionExceptionBuilder {

    private final String message;
    private String sessionId;
    private Throwable cause;
    private Integer attempt;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private UpstreamConnectionExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static UpstreamConnectionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new UpstreamConnectionExceptionBuilder(message);
    }

    public UpstreamConnectionExceptionBuilder session(String sessionId) {
        this.sessionId = sessionId;
        return this;
    }

    public UpstreamConnectionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets the reconnect attempt number the failure belongs to.
     *
     * @param attempt 1-based attempt counter
     * @return this builder for chaining
     */
    public UpstreamConnectionExceptionBuilder attempt(int attempt) {
        this.attempt = attempt;
        return this;
    }

    public UpstreamConnectionExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public UpstreamConnectionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (attempt={n}, durationMs={ms}, {key1}={val1}, ...) (session: {id})
     * </pre>
     *
     * @return constructed exception
     */
    public UpstreamConnectionException build() {
        String detailed = buildDetailedMessage();
        String session = sessionId != null ? sessionId : "unknown";
        if (cause != null) {
            return new UpstreamConnectionException(detailed, session, cause);
        }
        return new UpstreamConnectionException(detailed, session);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = attempt != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (attempt != null) {
            sb.append("attempt=").append(attempt);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
        return sb.append(")").toString();
    }
}
