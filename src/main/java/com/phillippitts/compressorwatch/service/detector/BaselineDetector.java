package com.phillippitts.compressorwatch.service.detector;

import com.phillippitts.compressorwatch.domain.Alert;
import com.phillippitts.compressorwatch.domain.AnomalyTypes;
import com.phillippitts.compressorwatch.domain.DetectionPhase;
import com.phillippitts.compressorwatch.domain.DetectionResult;
import com.phillippitts.compressorwatch.domain.DetectionSample;
import com.phillippitts.compressorwatch.exception.ValidationException;
import com.phillippitts.compressorwatch.service.metrics.DetectionMetricsPublisher;
import com.phillippitts.compressorwatch.service.scorer.SampleFileStager;
import com.phillippitts.compressorwatch.service.scorer.ScorerClient;
import com.phillippitts.compressorwatch.service.scorer.ScorerCommand;
import com.phillippitts.compressorwatch.service.scorer.ScorerFields;
import com.phillippitts.compressorwatch.service.scorer.ScorerRequest;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Objects;

/**
 * First stage: a scorer trained once on known-normal samples.
 *
 * <p>Tracks total detections, anomaly count and mean processing time. Detections before
 * {@link #train} return {@code model_not_initialized}.
 */
public class BaselineDetector extends AbstractDetector {

    public BaselineDetector(ScorerClient scorer, SampleFileStager stager, String modelPath,
                            DetectionMetricsPublisher metrics, ApplicationEventPublisher publisher) {
        super(DetectionPhase.BASELINE, scorer, stager, modelPath, metrics, publisher);
    }

    /**
     * Trains the scorer on normal samples and marks the detector ready.
     *
     * @param normalSamples known-normal samples (must not be empty)
     * @throws ValidationException if the list is null or empty
     * @throws com.phillippitts.compressorwatch.exception.ScorerException if the scorer fails
     */
    public void train(List<DetectionSample> normalSamples) {
        if (normalSamples == null || normalSamples.isEmpty()) {
            throw new ValidationException("samples", "training requires at least one normal sample");
        }
        if (normalSamples.stream().anyMatch(Objects::isNull)) {
            throw new ValidationException("samples", "must not contain null entries");
        }
        runSetup("train on " + normalSamples.size() + " samples", () ->
                withStagedSamples(normalSamples, ScorerCommand.TRAIN, staged -> {
                    callScorer(ScorerRequest.builder(ScorerCommand.TRAIN)
                            .field(ScorerFields.MODEL_PATH, modelPath)
                            .field(ScorerFields.FILES, staged.pathStrings())
                            .field(ScorerFields.SAMPLE_RATES,
                                    normalSamples.stream().map(DetectionSample::sampleRate).toList())
                            .build());
                    markReady();
                    return null;
                }));
    }

    /**
     * Scores one sample. Never throws for scorer problems.
     */
    public DetectionResult detect(DetectionSample sample) {
        return runDetection(sample, null, audioPath -> ScorerRequest.builder(ScorerCommand.DETECT)
                .field(ScorerFields.MODEL_PATH, modelPath)
                .field(ScorerFields.AUDIO_PATH, audioPath.toAbsolutePath().toString())
                .field(ScorerFields.SAMPLE_RATE, sample.sampleRate())
                .build());
    }

    public BaselineStats getStats() {
        stateLock.lock();
        try {
            return new BaselineStats(counters.snapshot(), counters.anomalyRate());
        } finally {
            stateLock.unlock();
        }
    }

    public void resetStats() {
        stateLock.lock();
        try {
            counters.reset();
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    protected String notReadyType() {
        return AnomalyTypes.MODEL_NOT_INITIALIZED;
    }

    @Override
    protected List<Alert> recordOutcome(DetectionResult result, Boolean groundTruth) {
        counters.recordDetection(result.anomalous(), result.processingTimeMs(), result.timestamp());
        return List.of();
    }
}
