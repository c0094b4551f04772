package com.phillippitts.streamscribe.service.session;

import java.time.Duration;

/**
 * Capped exponential backoff: attempt {@code n} (1-based) waits
 * {@code min(cap, base * multiplier^(n-1))}.
 */
public final class BackoffPolicy {

    private final long baseMs;
    private final double multiplier;
    private final long capMs;

    public BackoffPolicy(long baseMs, double multiplier, long capMs) {
        if (baseMs <= 0) {
            throw new IllegalArgumentException("baseMs must be positive");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (capMs < baseMs) {
            throw new IllegalArgumentException("capMs must be >= baseMs");
        }
        this.baseMs = baseMs;
        this.multiplier = multiplier;
        this.capMs = capMs;
    }

    /**
     * @param attempt 1-based consecutive failure count
     * @return delay before the next connect attempt
     */
    public Duration delayFor(int attempt) {
        if (attempt <= 1) {
            return Duration.ofMillis(baseMs);
        }
        double delay = baseMs * Math.pow(multiplier, attempt - 1);
        long ms = delay >= capMs ? capMs : (long) delay;
        return Duration.ofMillis(ms);
    }
}
