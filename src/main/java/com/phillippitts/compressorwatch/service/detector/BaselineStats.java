package com.phillippitts.compressorwatch.service.detector;

import com.phillippitts.compressorwatch.domain.PerformanceMetrics;

/**
 * @param anomalyRate anomalyCount / totalDetections, 0 before the first detection
 */
public record BaselineStats(PerformanceMetrics metrics, double anomalyRate) {
}
