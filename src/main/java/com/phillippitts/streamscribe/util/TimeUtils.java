package com.phillippitts.streamscribe.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Utility methods for time conversions and elapsed time calculations.
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
     * Converts nanoseconds to milliseconds (truncated).
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Calculates elapsed milliseconds since a {@link System#nanoTime()} timestamp.
     *
     * <pre>
     * long startTime = System.nanoTime();
     * // ... do work ...
     * long elapsedMs = TimeUtils.elapsedMillis(startTime);
     * </pre>
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Returns {@code true} when at least {@code window} has passed between {@code since} and {@code now}.
     * A {@code now} earlier than {@code since} (clock stepped backwards) never counts as elapsed.
     */
    public static boolean hasElapsed(Instant since, Instant now, Duration window) {
        return Duration.between(since, now).compareTo(window) >= 0;
    }
}
