package com.phillippitts.compressorwatch.service.detector;

import com.phillippitts.compressorwatch.domain.PerformanceMetrics;
import com.phillippitts.compressorwatch.util.RateMath;

import java.time.Instant;

/**
 * Mutable running counters of one detector. Not thread-safe: callers hold the detector's
 * state lock.
 *
 * <p>Accuracy, precision, recall and F1 are only recomputed when a detection carries ground
 * truth. True positives are derived as {@code anomalyCount - FP}, so precision is taken over
 * every predicted positive, labelled or not.
 */
final class DetectionCounters {

    private long totalDetections;
    private long anomalyCount;
    private long truePositives;
    private long falsePositives;
    private long falseNegatives;
    private double accuracy;
    private double precision;
    private double recall;
    private double f1Score;
    private double averageProcessingTimeMs;
    private Instant lastUpdate;

    void recordDetection(boolean anomalous, long processingTimeMs, Instant at) {
        totalDetections++;
        if (anomalous) {
            anomalyCount++;
        }
        averageProcessingTimeMs = RateMath.incrementalMean(averageProcessingTimeMs, processingTimeMs, totalDetections);
        lastUpdate = at;
    }

    /**
     * Updates the confusion counts for the detection just recorded and recomputes the rates.
     */
    void recordGroundTruth(boolean predicted, boolean actual) {
        if (predicted && !actual) {
            falsePositives++;
        } else if (!predicted && actual) {
            falseNegatives++;
        }
        truePositives = Math.max(0L, anomalyCount - falsePositives);
        accuracy = RateMath.ratio(totalDetections - falsePositives - falseNegatives, totalDetections);
        precision = RateMath.ratio(truePositives, anomalyCount);
        recall = RateMath.ratio(truePositives, truePositives + falseNegatives);
        f1Score = RateMath.f1(precision, recall);
    }

    long totalDetections() {
        return totalDetections;
    }

    double accuracy() {
        return accuracy;
    }

    double averageProcessingTimeMs() {
        return averageProcessingTimeMs;
    }

    double anomalyRate() {
        return RateMath.ratio(anomalyCount, totalDetections);
    }

    PerformanceMetrics snapshot() {
        return new PerformanceMetrics(totalDetections, anomalyCount, truePositives, falsePositives,
                falseNegatives, accuracy, precision, recall, f1Score, averageProcessingTimeMs, lastUpdate);
    }

    void reset() {
        totalDetections = 0;
        anomalyCount = 0;
        truePositives = 0;
        falsePositives = 0;
        falseNegatives = 0;
        accuracy = 0.0;
        precision = 0.0;
        recall = 0.0;
        f1Score = 0.0;
        averageProcessingTimeMs = 0.0;
        lastUpdate = null;
    }
}
