package com.phillippitts.compressorwatch.service.detector;

import com.phillippitts.compressorwatch.domain.AdaptationParams;
import com.phillippitts.compressorwatch.domain.Alert;
import com.phillippitts.compressorwatch.domain.DetectionPhase;
import com.phillippitts.compressorwatch.domain.DetectionResult;
import com.phillippitts.compressorwatch.domain.DetectionSample;
import com.phillippitts.compressorwatch.exception.DetectorNotInitializedException;
import com.phillippitts.compressorwatch.service.metrics.DetectionMetricsPublisher;
import com.phillippitts.compressorwatch.service.scorer.SampleFileStager;
import com.phillippitts.compressorwatch.service.scorer.ScorerClient;
import com.phillippitts.compressorwatch.service.scorer.ScorerCommand;
import com.phillippitts.compressorwatch.service.scorer.ScorerFields;
import com.phillippitts.compressorwatch.service.scorer.ScorerRequest;
import com.phillippitts.compressorwatch.util.RateMath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Second stage: an adaptive scorer seeded from a ready {@link BaselineDetector}.
 *
 * <p>Supports tunable {@link AdaptationParams}, forced re-fitting and accuracy tracking when
 * callers supply ground truth. Parameter updates use validate-and-filter semantics: fields
 * outside their range are dropped, never rejected.
 */
public class AdaptiveDetector extends AbstractDetector {

    private static final Logger LOG = LogManager.getLogger(AdaptiveDetector.class);

    // Guarded by stateLock
    private AdaptationParams params = AdaptationParams.defaults();
    private String baselineModelPath;
    private long totalAdaptations;
    private Instant lastAdaptation;
    private long thresholdUpdates;
    private long modelUpdates;
    private long labelledSinceAdaptation;
    private long correctSinceAdaptation;

    public AdaptiveDetector(ScorerClient scorer, SampleFileStager stager, String modelPath,
                            DetectionMetricsPublisher metrics, ApplicationEventPublisher publisher) {
        super(DetectionPhase.ADAPTIVE, scorer, stager, modelPath, metrics, publisher);
    }

    /**
     * Seeds the adaptive model from the baseline artifact and marks the detector ready.
     * Calling it again replaces the model.
     *
     * @throws DetectorNotInitializedException if the baseline is not ready
     * @throws com.phillippitts.compressorwatch.exception.ScorerException if the scorer fails
     */
    public void initialize(BaselineDetector baseline) {
        Objects.requireNonNull(baseline, "baseline");
        if (!baseline.isReady()) {
            throw new DetectorNotInitializedException(baseline.getDetectorName(),
                    "Baseline detector must be trained before initializing the adaptive stage");
        }
        runSetup("initialize", () -> {
            callScorer(ScorerRequest.builder(ScorerCommand.INITIALIZE)
                    .field(ScorerFields.MODEL_PATH, modelPath)
                    .field(ScorerFields.BASELINE_MODEL_PATH, baseline.getModelPath())
                    .field(ScorerFields.PARAMS, currentParams().asMap())
                    .build());
            stateLock.lock();
            try {
                baselineModelPath = baseline.getModelPath();
                if (isReady()) {
                    modelUpdates++;
                }
            } finally {
                stateLock.unlock();
            }
            markReady();
            return null;
        });
    }

    /**
     * Scores one sample with the current parameters. Never throws for scorer problems.
     *
     * @param groundTruth true when the sample is known anomalous, null when unknown
     */
    public DetectionResult detectAdaptive(DetectionSample sample, Boolean groundTruth) {
        AdaptationParams snapshot = currentParams();
        return runDetection(sample, groundTruth, audioPath -> ScorerRequest.builder(ScorerCommand.DETECT)
                .field(ScorerFields.MODEL_PATH, modelPath)
                .field(ScorerFields.AUDIO_PATH, audioPath.toAbsolutePath().toString())
                .field(ScorerFields.SAMPLE_RATE, sample.sampleRate())
                .field(ScorerFields.GROUND_TRUTH, groundTruth)
                .field(ScorerFields.PARAMS, snapshot.asMap())
                .build());
    }

    /**
     * Applies the in-range subset of {@code partial} and, when ready, forwards it to the scorer.
     *
     * <p>The local merge happens before forwarding, so a scorer failure still leaves the new
     * values stored.
     *
     * @param partial field name to value; unknown names, nulls and out-of-range values are dropped
     * @return the applied subset (empty when nothing was applied)
     * @throws com.phillippitts.compressorwatch.exception.ScorerException if forwarding fails
     */
    public Map<String, Double> updateParams(Map<String, Double> partial) {
        Map<String, Double> applied = AdaptationParams.acceptedFields(partial);
        if (applied.isEmpty()) {
            LOG.info("Adaptive parameter update applied no fields (requested={})",
                    partial == null ? 0 : partial.size());
            return applied;
        }
        return runSetup("update parameters " + applied.keySet(), () -> {
            stateLock.lock();
            try {
                params = params.merge(applied);
                thresholdUpdates++;
            } finally {
                stateLock.unlock();
            }
            if (isReady()) {
                callScorer(ScorerRequest.builder(ScorerCommand.UPDATE_PARAMS)
                        .field(ScorerFields.MODEL_PATH, modelPath)
                        .field(ScorerFields.PARAMS, applied)
                        .build());
            }
            return applied;
        });
    }

    /**
     * Re-fits the adaptive model on recently observed samples. Long-running; bounded by the
     * scorer setup timeout.
     *
     * @throws DetectorNotInitializedException if this detector is not ready
     * @throws com.phillippitts.compressorwatch.exception.ScorerException if the scorer fails
     */
    public AdaptiveStats forceAdaptiveUpdate() {
        if (!isReady()) {
            throw new DetectorNotInitializedException(getDetectorName());
        }
        return runSetup("forced adaptive update", () -> {
            callScorer(ScorerRequest.builder(ScorerCommand.FORCE_UPDATE)
                    .field(ScorerFields.MODEL_PATH, modelPath)
                    .field(ScorerFields.PARAMS, currentParams().asMap())
                    .build());
            stateLock.lock();
            try {
                totalAdaptations++;
                modelUpdates++;
                lastAdaptation = Instant.now();
                labelledSinceAdaptation = 0;
                correctSinceAdaptation = 0;
                return adaptiveStatsLocked();
            } finally {
                stateLock.unlock();
            }
        });
    }

    /**
     * Asks the scorer to persist the current model and parameters.
     *
     * @throws DetectorNotInitializedException if this detector is not ready
     */
    public void save() {
        if (!isReady()) {
            throw new DetectorNotInitializedException(getDetectorName());
        }
        runSetup("save", () -> callScorer(ScorerRequest.builder(ScorerCommand.SAVE)
                .field(ScorerFields.MODEL_PATH, modelPath)
                .field(ScorerFields.BASELINE_MODEL_PATH, baselineModelPath())
                .field(ScorerFields.PARAMS, currentParams().asMap())
                .build()));
    }

    public AdaptationParams currentParams() {
        stateLock.lock();
        try {
            return params;
        } finally {
            stateLock.unlock();
        }
    }

    public AdaptiveDetectorStats getAdaptiveStats() {
        stateLock.lock();
        try {
            return new AdaptiveDetectorStats(counters.snapshot(), counters.anomalyRate(), params,
                    adaptiveStatsLocked());
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Clears detection counters and adaptation bookkeeping. Parameters and readiness are kept.
     */
    public void resetStats() {
        stateLock.lock();
        try {
            counters.reset();
            totalAdaptations = 0;
            lastAdaptation = null;
            thresholdUpdates = 0;
            modelUpdates = 0;
            labelledSinceAdaptation = 0;
            correctSinceAdaptation = 0;
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    protected List<Alert> recordOutcome(DetectionResult result, Boolean groundTruth) {
        counters.recordDetection(result.anomalous(), result.processingTimeMs(), result.timestamp());
        if (groundTruth != null) {
            counters.recordGroundTruth(result.anomalous(), groundTruth);
            labelledSinceAdaptation++;
            if (result.anomalous() == groundTruth) {
                correctSinceAdaptation++;
            }
        }
        return List.of();
    }

    private String baselineModelPath() {
        stateLock.lock();
        try {
            return baselineModelPath;
        } finally {
            stateLock.unlock();
        }
    }

    private AdaptiveStats adaptiveStatsLocked() {
        return new AdaptiveStats(totalAdaptations, lastAdaptation,
                RateMath.ratio(correctSinceAdaptation, labelledSinceAdaptation), thresholdUpdates, modelUpdates);
    }
}
