package com.phillippitts.answercoach.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Utility methods for elapsed-time checks used by triggers, cooldowns and latency logging.
 *
 * @since 1.0
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
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Returns true when strictly more than {@code threshold} has passed between {@code from}
     * and {@code to}. A null {@code from} means "never" and always counts as elapsed.
     *
     * @param from      earlier instant, or null
     * @param to        later instant
     * @param threshold minimum gap
     * @return whether the gap exceeds the threshold
     */
    public static boolean exceeds(Instant from, Instant to, Duration threshold) {
        if (from == null) {
            return true;
        }
        return Duration.between(from, to).compareTo(threshold) > 0;
    }
}
