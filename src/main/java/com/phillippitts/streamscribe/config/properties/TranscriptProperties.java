package com.phillippitts.streamscribe.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Transcript buffering: dwell-based flush and near-duplicate suppression.
 */
@ConfigurationProperties(prefix = "stream.transcript")
@Validated
public class TranscriptProperties {

    /** Quiet period after the last accepted final fragment before the buffer is flushed. */
    @Positive
    private long flushDwellMs = 180_000;  // 3 minutes

    /** Fragments scoring strictly above this similarity against a recent fragment are dropped. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double duplicateThreshold = 0.85;

    /** Number of recent accepted fragments compared against. */
    @Positive
    private int recentWindowSize = 15;

    public long getFlushDwellMs() {
        return flushDwellMs;
    }

    public void setFlushDwellMs(long flushDwellMs) {
        this.flushDwellMs = flushDwellMs;
    }

    public double getDuplicateThreshold() {
        return duplicateThreshold;
    }

    public void setDuplicateThreshold(double duplicateThreshold) {
        this.duplicateThreshold = duplicateThreshold;
    }

    public int getRecentWindowSize() {
        return recentWindowSize;
    }

    public void setRecentWindowSize(int recentWindowSize) {
        this.recentWindowSize = recentWindowSize;
    }
}
