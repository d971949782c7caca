package com.phillippitts.compressorwatch.service.detector;

import com.phillippitts.compressorwatch.domain.AnomalyTypes;
import com.phillippitts.compressorwatch.domain.DetectionResult;
import com.phillippitts.compressorwatch.domain.DetectionSample;
import com.phillippitts.compressorwatch.exception.ScorerException;
import com.phillippitts.compressorwatch.exception.ValidationException;
import com.phillippitts.compressorwatch.service.events.ScorerFailureEvent;
import com.phillippitts.compressorwatch.service.metrics.DetectionMetricsPublisher;
import com.phillippitts.compressorwatch.service.scorer.SampleFileStager;
import com.phillippitts.compressorwatch.service.scorer.ScorerCommand;
import com.phillippitts.compressorwatch.service.scorer.ScorerFields;
import com.phillippitts.compressorwatch.service.scorer.ScorerRequest;
import com.phillippitts.compressorwatch.testutil.EventCapturingPublisher;
import com.phillippitts.compressorwatch.testutil.FakeScorerClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BaselineDetectorTest {

    @TempDir
    Path workDir;

    private FakeScorerClient scorer;
    private EventCapturingPublisher events;
    private BaselineDetector detector;

    @BeforeEach
    void setUp() {
        scorer = new FakeScorerClient("baseline");
        events = new EventCapturingPublisher();
        detector = new BaselineDetector(scorer, new SampleFileStager(workDir), "models/phase1/",
                DetectionMetricsPublisher.NOOP, events);
    }

    private static DetectionSample sample() {
        return DetectionSample.of(new byte[]{10, 20, 30, 40});
    }

    @Test
    void detectBeforeTrainingReturnsModelNotInitialized() {
        DetectionResult result = detector.detect(sample());

        assertThat(result.anomalous()).isFalse();
        assertThat(result.confidence()).isZero();
        assertThat(result.anomalyType()).isEqualTo(AnomalyTypes.MODEL_NOT_INITIALIZED);
        assertThat(scorer.requests()).isEmpty();
        assertThat(detector.getStats().metrics().totalDetections()).isZero();
    }

    @Test
    void trainRejectsEmptyOrNullSampleSets() {
        assertThatThrownBy(() -> detector.train(List.of()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("samples");
        assertThatThrownBy(() -> detector.train(null))
                .isInstanceOf(ValidationException.class);
        List<DetectionSample> withNull = new ArrayList<>();
        withNull.add(sample());
        withNull.add(null);
        assertThatThrownBy(() -> detector.train(withNull))
                .isInstanceOf(ValidationException.class);

        assertThat(detector.isReady()).isFalse();
        assertThat(scorer.requests()).isEmpty();
    }

    @Test
    void trainSendsAllSamplesAndMarksReady() throws Exception {
        detector.train(List.of(sample(), new DetectionSample(new byte[]{1}, 44_100)));

        assertThat(detector.getState()).isEqualTo(DetectorState.READY);
        ScorerRequest train = scorer.requests(ScorerCommand.TRAIN).get(0);
        assertThat(train.fields().get(ScorerFields.MODEL_PATH)).isEqualTo("models/phase1/");
        assertThat((List<?>) train.fields().get(ScorerFields.FILES)).hasSize(2);
        assertThat((List<Object>) train.fields().get(ScorerFields.SAMPLE_RATES)).containsExactly(16_000, 44_100);
        try (Stream<Path> staged = Files.list(workDir)) {
            assertThat(staged).isEmpty();
        }
    }

    @Test
    void failedTrainingLeavesDetectorUninitialized() {
        scorer.failNext("Non-zero exit: 1");

        assertThatThrownBy(() -> detector.train(List.of(sample())))
                .isInstanceOf(ScorerException.class)
                .hasMessageContaining("Non-zero exit: 1");

        assertThat(detector.isReady()).isFalse();
        assertThat(events.eventsOf(ScorerFailureEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.command()).isEqualTo("train"));
    }

    @Test
    void detectionsUpdateCountersAndMean() {
        detector.train(List.of(sample()));
        scorer.respondWith(FakeScorerClient.anomaly(0.9), FakeScorerClient.normal(0.7),
                FakeScorerClient.anomaly(0.8));

        List<DetectionResult> results = List.of(detector.detect(sample()), detector.detect(sample()),
                detector.detect(sample()));

        BaselineStats stats = detector.getStats();
        assertThat(stats.metrics().totalDetections()).isEqualTo(3);
        assertThat(stats.metrics().anomalyCount()).isEqualTo(2);
        assertThat(stats.anomalyRate()).isCloseTo(2.0 / 3.0, within(1e-9));
        double expectedMean = results.stream().mapToLong(DetectionResult::processingTimeMs).average().orElse(0);
        assertThat(stats.metrics().averageProcessingTimeMs()).isCloseTo(expectedMean, within(1e-6));
        assertThat(stats.metrics().lastUpdate()).isNotNull();
        assertThat(results.get(0).reliability()).isNull();
    }

    @Test
    void averageProcessingTimeFollowsIncrementalMean() {
        detector.train(List.of(sample()));
        scorer.delayDetections(20, 80, 140);

        DetectionResult first = detector.detect(sample());
        assertThat(detector.getStats().metrics().averageProcessingTimeMs())
                .isCloseTo(first.processingTimeMs(), within(1e-6));

        DetectionResult second = detector.detect(sample());
        DetectionResult third = detector.detect(sample());

        assertThat(first.processingTimeMs()).isGreaterThanOrEqualTo(20);
        assertThat(second.processingTimeMs()).isGreaterThanOrEqualTo(80);
        assertThat(third.processingTimeMs()).isGreaterThanOrEqualTo(140);
        double expectedMean = (first.processingTimeMs() + second.processingTimeMs() + third.processingTimeMs()) / 3.0;
        assertThat(detector.getStats().metrics().averageProcessingTimeMs())
                .isCloseTo(expectedMean, within(1e-6))
                .isGreaterThanOrEqualTo(80.0);
    }

    @Test
    void statsReadsAreIdempotent() {
        detector.train(List.of(sample()));
        detector.detect(sample());

        assertThat(detector.getStats()).isEqualTo(detector.getStats());
    }

    @Test
    void scorerFailureDuringDetectionIsSoft() {
        detector.train(List.of(sample()));
        scorer.failNext("Timeout after 30000ms");

        DetectionResult result = detector.detect(sample());

        assertThat(result.anomalyType()).isEqualTo(AnomalyTypes.ERROR);
        assertThat(result.anomalous()).isFalse();
        assertThat(result.message()).startsWith("Detection failed:").contains("Timeout after 30000ms");
        assertThat(result.isFailure()).isTrue();
        assertThat(detector.getStats().metrics().totalDetections()).isZero();
        assertThat(events.eventsOf(ScorerFailureEvent.class)).hasSize(1);
    }

    @Test
    void detectRequestCarriesStagedAudioPath() {
        detector.train(List.of(sample()));

        detector.detect(new DetectionSample(new byte[]{5, 6}, 22_050));

        ScorerRequest detect = scorer.requests(ScorerCommand.DETECT).get(0);
        assertThat((String) detect.fields().get(ScorerFields.AUDIO_PATH)).endsWith(".wav");
        assertThat(detect.fields().get(ScorerFields.SAMPLE_RATE)).isEqualTo(22_050);
    }

    @Test
    void nullSampleIsRejected() {
        assertThatThrownBy(() -> detector.detect(null)).isInstanceOf(ValidationException.class);
    }

    @Test
    void resetClearsCountersButKeepsReadiness() {
        detector.train(List.of(sample()));
        detector.detect(sample());

        detector.resetStats();

        assertThat(detector.getStats().metrics().totalDetections()).isZero();
        assertThat(detector.isReady()).isTrue();
    }
}
