package com.phillippitts.compressorwatch.domain;

import java.time.Instant;

/**
 * Point-in-time copy of a detector's counters and derived rates.
 * Rate fields are 0 whenever their denominator is 0.
 *
 * @param lastUpdate time of the last recorded detection, null if none yet
 */
public record PerformanceMetrics(
        long totalDetections,
        long anomalyCount,
        long truePositives,
        long falsePositives,
        long falseNegatives,
        double accuracy,
        double precision,
        double recall,
        double f1Score,
        double averageProcessingTimeMs,
        Instant lastUpdate
) {

    public static PerformanceMetrics empty() {
        return new PerformanceMetrics(0, 0, 0, 0, 0, 0.0, 0.0, 0.0, 0.0, 0.0, null);
    }
}
