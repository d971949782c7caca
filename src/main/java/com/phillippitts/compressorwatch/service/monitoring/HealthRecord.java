package com.phillippitts.compressorwatch.service.monitoring;

import java.time.Instant;

/**
 * Readiness flags and reported reliability at the time of a detection.
 */
public record HealthRecord(
        Instant timestamp,
        boolean phase1Ready,
        boolean phase2Ready,
        boolean integratedReady,
        boolean overallReady,
        double reliability
) {
}
