package com.phillippitts.compressorwatch.service.detector;

import com.phillippitts.compressorwatch.domain.AdaptationParams;
import com.phillippitts.compressorwatch.domain.PerformanceMetrics;

public record AdaptiveDetectorStats(
        PerformanceMetrics metrics,
        double anomalyRate,
        AdaptationParams params,
        AdaptiveStats adaptiveStats
) {
}
