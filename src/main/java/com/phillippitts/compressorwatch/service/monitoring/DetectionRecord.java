package com.phillippitts.compressorwatch.service.monitoring;

import java.time.Instant;

/**
 * One integrated detection as kept in the detection history.
 *
 * @param reliability 0 when the scorer did not report one
 * @param groundTruth caller-supplied label, null when absent
 */
public record DetectionRecord(
        Instant timestamp,
        boolean anomalous,
        double confidence,
        String anomalyType,
        double reliability,
        long processingTimeMs,
        Boolean groundTruth
) {
}
