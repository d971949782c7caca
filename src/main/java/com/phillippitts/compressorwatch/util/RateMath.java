package com.phillippitts.compressorwatch.util;

/**
 * Guarded arithmetic for derived rates. Every rate exposed by the detectors goes through here
 * so a zero denominator yields 0 instead of NaN or infinity.
 *
 * @since 1.0
 */
public final class RateMath {

    private RateMath() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns {@code numerator / denominator}, or 0 when the denominator is 0
     * or the quotient is not finite.
     */
    public static double ratio(double numerator, double denominator) {
        if (denominator == 0.0) {
            return 0.0;
        }
        double value = numerator / denominator;
        return Double.isFinite(value) ? value : 0.0;
    }

    /**
     * Harmonic mean of precision and recall; 0 when both are 0.
     */
    public static double f1(double precision, double recall) {
        return ratio(2.0 * precision * recall, precision + recall);
    }

    /**
     * Incremental mean: {@code avg + (value - avg) / n}.
     *
     * @param currentAverage mean of the first {@code n - 1} values
     * @param value the n-th value
     * @param n number of values including {@code value}; must be at least 1
     * @return mean of all {@code n} values
     */
    public static double incrementalMean(double currentAverage, double value, long n) {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be positive");
        }
        return currentAverage + (value - currentAverage) / n;
    }

    /**
     * Returns true when {@code value} lies in the closed interval [0, 1].
     */
    public static boolean isUnitInterval(double value) {
        return value >= 0.0 && value <= 1.0;
    }
}
