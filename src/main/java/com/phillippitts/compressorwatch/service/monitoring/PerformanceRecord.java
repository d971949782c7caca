package com.phillippitts.compressorwatch.service.monitoring;

import java.time.Instant;

/**
 * Performance sample taken after each integrated detection.
 *
 * @param accuracy         engine accuracy after the detection
 * @param processingTimeMs time of this detection only
 * @param anomalyRate      cumulative anomaly rate after the detection
 */
public record PerformanceRecord(Instant timestamp, double accuracy, long processingTimeMs, double anomalyRate) {
}
