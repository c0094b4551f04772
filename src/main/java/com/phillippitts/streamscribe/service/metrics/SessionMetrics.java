package com.phillippitts.streamscribe.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Centralized metrics for streaming sessions.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Session lifecycle (created, closed by reason, active gauge)</li>
 *   <li>Upstream connection health (reconnects, failures by reason)</li>
 *   <li>Transcript buffering (fragments by outcome, flushes by trigger, hand-off failures)</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class SessionMetrics {

    static final String METRIC_PREFIX = "streamscribe";

    private final MeterRegistry registry;

    public SessionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void sessionCreated() {
        Counter.builder(METRIC_PREFIX + ".sessions.created")
                .description("Number of transcription sessions created")
                .register(registry)
                .increment();
    }

    /**
     * @param reason close reason (client_disconnect, inactivity, reconnect_budget_exhausted, ...)
     */
    public void sessionClosed(String reason) {
        Counter.builder(METRIC_PREFIX + ".sessions.closed")
                .description("Number of transcription sessions closed")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Binds the active-sessions gauge to a live count.
     *
     * @param activeSessions supplier of the current number of registered sessions
     */
    public void bindActiveSessions(Supplier<Number> activeSessions) {
        Gauge.builder(METRIC_PREFIX + ".sessions.active", activeSessions)
                .description("Number of registered transcription sessions")
                .register(registry);
    }

    public void reconnectAttempted() {
        Counter.builder(METRIC_PREFIX + ".connection.reconnects")
                .description("Number of upstream reconnect attempts")
                .register(registry)
                .increment();
    }

    /**
     * @param reason failure cause (connect_failed, connect_timeout, send_failed, dropped)
     */
    public void connectionFailed(String reason) {
        Counter.builder(METRIC_PREFIX + ".connection.failures")
                .description("Number of upstream connection failures")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void decodeError() {
        Counter.builder(METRIC_PREFIX + ".audio.decode.errors")
                .description("Number of audio packets dropped because they failed to decode")
                .register(registry)
                .increment();
    }

    /**
     * @param outcome accepted, duplicate, interim_ignored or rejected_closed
     */
    public void fragment(String outcome) {
        Counter.builder(METRIC_PREFIX + ".transcript.fragments")
                .description("Number of transcript fragments by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * @param trigger inactivity, forced or teardown
     */
    public void flushed(String trigger) {
        Counter.builder(METRIC_PREFIX + ".transcript.flushes")
                .description("Number of transcript blocks flushed downstream")
                .tag("trigger", trigger)
                .register(registry)
                .increment();
    }

    public void handoffFailed() {
        Counter.builder(METRIC_PREFIX + ".handoff.failures")
                .description("Number of transcript blocks the downstream sink rejected")
                .register(registry)
                .increment();
    }
}
