package com.phillippitts.streamscribe.config.properties;

import com.phillippitts.streamscribe.service.upstream.KeepAliveMode;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Upstream connection lifecycle: keep-alive, auto-close and reconnect budget.
 *
 * <p>Backoff delay for attempt {@code n} (1-based) is
 * {@code min(backoffCapMs, backoffBaseMs * backoffMultiplier^(n-1))}.
 */
@ConfigurationProperties(prefix = "stream.connection")
@Validated
public class ConnectionProperties {

    /** Heartbeat period while the upstream socket is open. */
    @Positive
    private long keepAliveIntervalMs = 10_000;

    @NotNull
    private KeepAliveMode keepAliveMode = KeepAliveMode.SILENCE;

    /** Close the session after this long without a genuine audio packet. */
    @Positive
    private long autoCloseInactivityMs = 30_000;

    /** Consecutive connection failures tolerated before the session is terminated. */
    @Min(0)
    private int maxReconnectAttempts = 5;

    @Positive
    private long backoffBaseMs = 1_000;

    @DecimalMin("1.0")
    private double backoffMultiplier = 1.5;

    @Positive
    private long backoffCapMs = 30_000;

    /** Audio queued while the socket is not open; oldest chunks are dropped beyond this. */
    @Positive
    private int maxPendingAudioBytes = 320_000;  // 10 s of 16 kHz mono PCM16

    public long getKeepAliveIntervalMs() {
        return keepAliveIntervalMs;
    }

    public void setKeepAliveIntervalMs(long keepAliveIntervalMs) {
        this.keepAliveIntervalMs = keepAliveIntervalMs;
    }

    public KeepAliveMode getKeepAliveMode() {
        return keepAliveMode;
    }

    public void setKeepAliveMode(KeepAliveMode keepAliveMode) {
        this.keepAliveMode = keepAliveMode;
    }

    public long getAutoCloseInactivityMs() {
        return autoCloseInactivityMs;
    }

    public void setAutoCloseInactivityMs(long autoCloseInactivityMs) {
        this.autoCloseInactivityMs = autoCloseInactivityMs;
    }

    public int getMaxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    public void setMaxReconnectAttempts(int maxReconnectAttempts) {
        this.maxReconnectAttempts = maxReconnectAttempts;
    }

    public long getBackoffBaseMs() {
        return backoffBaseMs;
    }

    public void setBackoffBaseMs(long backoffBaseMs) {
        this.backoffBaseMs = backoffBaseMs;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public long getBackoffCapMs() {
        return backoffCapMs;
    }

    public void setBackoffCapMs(long backoffCapMs) {
        this.backoffCapMs = backoffCapMs;
    }

    public int getMaxPendingAudioBytes() {
        return maxPendingAudioBytes;
    }

    public void setMaxPendingAudioBytes(int maxPendingAudioBytes) {
        this.maxPendingAudioBytes = maxPendingAudioBytes;
    }
}
