package com.phillippitts.streamscribe.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Utility methods for time conversions and elapsed time calculations.
 *
 * <p>Provides convenient methods for converting between nanoseconds and milliseconds,
 * commonly used for performance timing with {@link System#nanoTime()}.
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts nanoseconds to milliseconds.
     *
     * @param nanos time in nanoseconds
     * @return time in milliseconds (truncated)
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Milliseconds from {@code now} until {@code deadline}, floored at zero.
     *
     * @param now      current instant
     * @param deadline target instant, or null for "none"
     * @return remaining milliseconds, 0 when the deadline is null or already passed
     */
    public static long remainingMillis(Instant now, Instant deadline) {
        if (deadline == null) {
            return 0L;
        }
        long ms = Duration.between(now, deadline).toMillis();
        return Math.max(0L, ms);
    }
}
