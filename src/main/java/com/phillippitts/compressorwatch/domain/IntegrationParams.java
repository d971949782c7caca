package com.phillippitts.compressorwatch.domain;

import com.phillippitts.compressorwatch.util.RateMath;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.DoublePredicate;

/**
 * Fusion weights and thresholds of the consensus stage. Every field lies in [0, 1].
 */
public record IntegrationParams(
        double phase1Weight,
        double phase2Weight,
        double integratedWeight,
        double consensusThreshold,
        double confidenceThreshold,
        double reliabilityThreshold
) {

    public static final String PHASE1_WEIGHT = "phase1Weight";
    public static final String PHASE2_WEIGHT = "phase2Weight";
    public static final String INTEGRATED_WEIGHT = "integratedWeight";
    public static final String CONSENSUS_THRESHOLD = "consensusThreshold";
    public static final String CONFIDENCE_THRESHOLD = "confidenceThreshold";
    public static final String RELIABILITY_THRESHOLD = "reliabilityThreshold";

    private static final Map<String, DoublePredicate> RANGES = ranges();

    public static IntegrationParams defaults() {
        return new IntegrationParams(0.3, 0.4, 0.3, 0.6, 0.7, 0.8);
    }

    public static Map<String, Double> acceptedFields(Map<String, Double> partial) {
        return ParameterFilter.accept(partial, RANGES);
    }

    public IntegrationParams merge(Map<String, Double> applied) {
        return new IntegrationParams(
                ParameterFilter.pick(applied, PHASE1_WEIGHT, phase1Weight),
                ParameterFilter.pick(applied, PHASE2_WEIGHT, phase2Weight),
                ParameterFilter.pick(applied, INTEGRATED_WEIGHT, integratedWeight),
                ParameterFilter.pick(applied, CONSENSUS_THRESHOLD, consensusThreshold),
                ParameterFilter.pick(applied, CONFIDENCE_THRESHOLD, confidenceThreshold),
                ParameterFilter.pick(applied, RELIABILITY_THRESHOLD, reliabilityThreshold));
    }

    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put(PHASE1_WEIGHT, phase1Weight);
        map.put(PHASE2_WEIGHT, phase2Weight);
        map.put(INTEGRATED_WEIGHT, integratedWeight);
        map.put(CONSENSUS_THRESHOLD, consensusThreshold);
        map.put(CONFIDENCE_THRESHOLD, confidenceThreshold);
        map.put(RELIABILITY_THRESHOLD, reliabilityThreshold);
        return map;
    }

    private static Map<String, DoublePredicate> ranges() {
        Map<String, DoublePredicate> ranges = new LinkedHashMap<>();
        ranges.put(PHASE1_WEIGHT, RateMath::isUnitInterval);
        ranges.put(PHASE2_WEIGHT, RateMath::isUnitInterval);
        ranges.put(INTEGRATED_WEIGHT, RateMath::isUnitInterval);
        ranges.put(CONSENSUS_THRESHOLD, RateMath::isUnitInterval);
        ranges.put(CONFIDENCE_THRESHOLD, RateMath::isUnitInterval);
        ranges.put(RELIABILITY_THRESHOLD, RateMath::isUnitInterval);
        return ranges;
    }
}
