package com.phillippitts.compressorwatch.domain;

import com.phillippitts.compressorwatch.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectionResultTest {

    @Test
    void shouldRejectConfidenceOutsideUnitInterval() {
        assertThatThrownBy(() -> new DetectionResult(true, 1.2, 0.5, "anomaly", null, null, null, 0,
                DetectionPhase.BASELINE, Instant.now()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("confidence");
    }

    @Test
    void shouldRejectNegativeProcessingTime() {
        assertThatThrownBy(() -> new DetectionResult(false, 0.5, 0.5, "normal", null, null, null, -1,
                DetectionPhase.BASELINE, Instant.now()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void softFailureIsNonAnomalousWithZeroScores() {
        DetectionResult result = DetectionResult.softFailure(DetectionPhase.ADAPTIVE,
                AnomalyTypes.MODEL_NOT_INITIALIZED, "not ready", 3);

        assertThat(result.isFailure()).isTrue();
        assertThat(result.anomalous()).isFalse();
        assertThat(result.confidence()).isZero();
        assertThat(result.reliability()).isNull();
    }

    @Test
    void normalResultIsNotFailure() {
        DetectionResult result = new DetectionResult(false, 0.9, 0.1, AnomalyTypes.NORMAL, 0.8, 0.67, null, 5,
                DetectionPhase.CONSENSUS, Instant.now());

        assertThat(result.isFailure()).isFalse();
    }

    @Test
    void sampleRejectsEmptyAudioAndBadRate() {
        assertThatThrownBy(() -> DetectionSample.of(new byte[0])).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new DetectionSample(new byte[]{1}, 0))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("sampleRate");
        assertThat(DetectionSample.of(new byte[]{1, 2}).sampleRate()).isEqualTo(DetectionSample.DEFAULT_SAMPLE_RATE);
    }
}
