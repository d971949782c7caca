package com.phillippitts.compressorwatch.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable outcome of one detection call on any stage.
 *
 * @param anomalous        whether the sample was flagged as anomalous
 * @param confidence       per-sample confidence in [0, 1]
 * @param anomalyScore     anomaly score in [0, 1]
 * @param anomalyType      scorer label or one of {@link AnomalyTypes}
 * @param reliability      fused-decision reliability in [0, 1]; consensus stage only, else null
 * @param consensusRate    fraction of underlying detectors agreeing; consensus stage only, else null
 * @param message          human-readable note (never contains sample data), may be null
 * @param processingTimeMs wall-clock time of the scorer call
 * @param phase            stage that produced the result
 * @param timestamp        completion time
 */
public record DetectionResult(
        boolean anomalous,
        double confidence,
        double anomalyScore,
        String anomalyType,
        Double reliability,
        Double consensusRate,
        String message,
        long processingTimeMs,
        DetectionPhase phase,
        Instant timestamp
) {

    public DetectionResult {
        requireUnit("confidence", confidence);
        requireUnit("anomalyScore", anomalyScore);
        if (reliability != null) {
            requireUnit("reliability", reliability);
        }
        if (consensusRate != null) {
            requireUnit("consensusRate", consensusRate);
        }
        if (processingTimeMs < 0) {
            throw new IllegalArgumentException("processingTimeMs must be >= 0, got: " + processingTimeMs);
        }
        Objects.requireNonNull(anomalyType, "anomalyType must not be null");
        Objects.requireNonNull(phase, "phase must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    /**
     * Result returned instead of an exception on detection paths.
     *
     * @param phase stage reporting the failure
     * @param anomalyType {@link AnomalyTypes#ERROR}, {@link AnomalyTypes#MODEL_NOT_INITIALIZED}
     *                    or {@link AnomalyTypes#SYSTEM_NOT_INITIALIZED}
     * @param message short diagnostic
     * @param processingTimeMs time spent before the failure
     */
    public static DetectionResult softFailure(DetectionPhase phase, String anomalyType,
                                              String message, long processingTimeMs) {
        return new DetectionResult(false, 0.0, 0.0, anomalyType, null, null, message,
                processingTimeMs, phase, Instant.now());
    }

    public boolean isFailure() {
        return AnomalyTypes.ERROR.equals(anomalyType)
                || AnomalyTypes.MODEL_NOT_INITIALIZED.equals(anomalyType)
                || AnomalyTypes.SYSTEM_NOT_INITIALIZED.equals(anomalyType);
    }

    private static void requireUnit(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0, got: " + value);
        }
    }
}
