package com.phillippitts.compressorwatch.domain;

import com.phillippitts.compressorwatch.util.RateMath;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.DoublePredicate;

/**
 * Tunable parameters of the adaptive stage.
 *
 * @param sensitivity         in [0, 1]
 * @param learningRate        in (0, 1]
 * @param confidenceThreshold in [0, 1]
 * @param anomalyThreshold    in [0, 1]
 * @param adaptationThreshold in [0, 1]
 */
public record AdaptationParams(
        double sensitivity,
        double learningRate,
        double confidenceThreshold,
        double anomalyThreshold,
        double adaptationThreshold
) {

    public static final String SENSITIVITY = "sensitivity";
    public static final String LEARNING_RATE = "learningRate";
    public static final String CONFIDENCE_THRESHOLD = "confidenceThreshold";
    public static final String ANOMALY_THRESHOLD = "anomalyThreshold";
    public static final String ADAPTATION_THRESHOLD = "adaptationThreshold";

    private static final Map<String, DoublePredicate> RANGES = ranges();

    public static AdaptationParams defaults() {
        return new AdaptationParams(0.1, 0.01, 0.7, 0.05, 0.1);
    }

    /**
     * Returns the subset of {@code partial} whose keys are known and whose values are in range.
     */
    public static Map<String, Double> acceptedFields(Map<String, Double> partial) {
        return ParameterFilter.accept(partial, RANGES);
    }

    /**
     * Returns a copy with the given already-validated fields replaced.
     */
    public AdaptationParams merge(Map<String, Double> applied) {
        return new AdaptationParams(
                ParameterFilter.pick(applied, SENSITIVITY, sensitivity),
                ParameterFilter.pick(applied, LEARNING_RATE, learningRate),
                ParameterFilter.pick(applied, CONFIDENCE_THRESHOLD, confidenceThreshold),
                ParameterFilter.pick(applied, ANOMALY_THRESHOLD, anomalyThreshold),
                ParameterFilter.pick(applied, ADAPTATION_THRESHOLD, adaptationThreshold));
    }

    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put(SENSITIVITY, sensitivity);
        map.put(LEARNING_RATE, learningRate);
        map.put(CONFIDENCE_THRESHOLD, confidenceThreshold);
        map.put(ANOMALY_THRESHOLD, anomalyThreshold);
        map.put(ADAPTATION_THRESHOLD, adaptationThreshold);
        return map;
    }

    private static Map<String, DoublePredicate> ranges() {
        Map<String, DoublePredicate> ranges = new LinkedHashMap<>();
        ranges.put(SENSITIVITY, RateMath::isUnitInterval);
        ranges.put(LEARNING_RATE, v -> v > 0.0 && v <= 1.0);
        ranges.put(CONFIDENCE_THRESHOLD, RateMath::isUnitInterval);
        ranges.put(ANOMALY_THRESHOLD, RateMath::isUnitInterval);
        ranges.put(ADAPTATION_THRESHOLD, RateMath::isUnitInterval);
        return ranges;
    }
}
