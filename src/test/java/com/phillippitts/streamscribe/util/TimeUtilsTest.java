package com.phillippitts.streamscribe.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void shouldConvertNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(1_000_000L)).isEqualTo(1L);
        assertThat(TimeUtils.nanosToMillis(100_000_000L)).isEqualTo(100L);
    }

    @Test
    void shouldTruncateNanosToMillis() {
        // 2.999 milliseconds truncates to 2 milliseconds
        assertThat(TimeUtils.nanosToMillis(2_999_999L)).isEqualTo(2L);
    }

    @Test
    void shouldCalculateElapsedMillisFromPastTimestamp() {
        long startNanos = System.nanoTime() - (1_000L * TimeUtils.NANOS_PER_MILLI);

        long elapsedMs = TimeUtils.elapsedMillis(startNanos);

        assertThat(elapsedMs).isGreaterThanOrEqualTo(1_000L);
        assertThat(elapsedMs).isLessThan(2_000L);
    }

    @Test
    void remainingMillisUntilFutureDeadline() {
        assertThat(TimeUtils.remainingMillis(NOW, NOW.plusMillis(1_500))).isEqualTo(1_500L);
    }

    @Test
    void remainingMillisIsZeroForPastOrMissingDeadline() {
        assertThat(TimeUtils.remainingMillis(NOW, NOW.minusSeconds(1))).isZero();
        assertThat(TimeUtils.remainingMillis(NOW, null)).isZero();
    }
}
