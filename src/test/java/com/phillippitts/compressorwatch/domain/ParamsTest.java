package com.phillippitts.compressorwatch.domain;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ParamsTest {

    @Test
    void adaptationDropsUnknownAndOutOfRangeFields() {
        Map<String, Double> partial = new HashMap<>();
        partial.put("sensitivity", 0.3);
        partial.put("learningRate", 0.0);
        partial.put("anomalyThreshold", 1.5);
        partial.put("bogus", 0.5);
        partial.put("confidenceThreshold", null);

        assertThat(AdaptationParams.acceptedFields(partial)).containsExactly(Map.entry("sensitivity", 0.3));
    }

    @Test
    void learningRateAcceptsUpperBound() {
        assertThat(AdaptationParams.acceptedFields(Map.of("learningRate", 1.0)))
                .containsEntry("learningRate", 1.0);
    }

    @Test
    void nullOrEmptyPartialYieldsEmptySet() {
        assertThat(AdaptationParams.acceptedFields(null)).isEmpty();
        assertThat(IntegrationParams.acceptedFields(Map.of())).isEmpty();
    }

    @Test
    void mergeReplacesOnlyAppliedFields() {
        AdaptationParams merged = AdaptationParams.defaults().merge(Map.of("sensitivity", 0.5));

        assertThat(merged.sensitivity()).isEqualTo(0.5);
        assertThat(merged.learningRate()).isEqualTo(AdaptationParams.defaults().learningRate());
    }

    @Test
    void integrationAcceptsBoundsAndRejectsNegatives() {
        Map<String, Double> accepted = IntegrationParams.acceptedFields(
                Map.of("phase1Weight", 0.0, "phase2Weight", 1.0, "integratedWeight", -0.1));

        assertThat(accepted).containsOnlyKeys("phase1Weight", "phase2Weight");
        IntegrationParams merged = IntegrationParams.defaults().merge(accepted);
        assertThat(merged.phase1Weight()).isZero();
        assertThat(merged.integratedWeight()).isEqualTo(0.3);
    }

    @Test
    void asMapListsEveryField() {
        assertThat(IntegrationParams.defaults().asMap()).hasSize(6);
        assertThat(AdaptationParams.defaults().asMap()).containsKeys("adaptationThreshold", "confidenceThreshold");
    }
}
