package com.phillippitts.compressorwatch.util;

/**
 * Utility methods for time conversions and elapsed time calculations.
 *
 * <p>Used with {@link System#nanoTime()} for wall-clock timing of scorer calls.
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
     *
     * @param nanos time in nanoseconds
     * @return time in milliseconds
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos, never negative
     */
    public static long elapsedMillis(long startNanos) {
        return Math.max(0L, (System.nanoTime() - startNanos) / NANOS_PER_MILLI);
    }
}
