package com.phillippitts.answercoach.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    @Test
    void exceedsIsStrict() {
        Duration twenty = Duration.ofSeconds(20);

        assertThat(TimeUtils.exceeds(T0, T0.plusSeconds(20), twenty)).isFalse();
        assertThat(TimeUtils.exceeds(T0, T0.plusMillis(20_001), twenty)).isTrue();
        assertThat(TimeUtils.exceeds(T0, T0.plusSeconds(5), twenty)).isFalse();
    }

    @Test
    void nullStartAlwaysCountsAsElapsed() {
        assertThat(TimeUtils.exceeds(null, T0, Duration.ofDays(1))).isTrue();
    }

    @Test
    void elapsedMillisIsNonNegative() {
        long start = System.nanoTime();

        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(0L);
        assertThat(TimeUtils.elapsedMillis(start - 5 * TimeUtils.NANOS_PER_MILLI)).isGreaterThanOrEqualTo(5L);
    }
}
