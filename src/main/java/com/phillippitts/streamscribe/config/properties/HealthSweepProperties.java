package com.phillippitts.streamscribe.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Periodic stale-session sweep.
 */
@ConfigurationProperties(prefix = "stream.health")
@Validated
public class HealthSweepProperties {

    @Positive
    private long sweepIntervalMs = 60_000;

    /** Sessions with no activity for longer than this are torn down by the sweeper. */
    @Positive
    private long staleAfterMs = 300_000;

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
        this.sweepIntervalMs = sweepIntervalMs;
    }

    public long getStaleAfterMs() {
        return staleAfterMs;
    }

    public void setStaleAfterMs(long staleAfterMs) {
        this.staleAfterMs = staleAfterMs;
    }
}
