package com.phillippitts.compressorwatch.service.detector;

import com.phillippitts.compressorwatch.domain.Alert;
import com.phillippitts.compressorwatch.domain.DetectionPhase;
import com.phillippitts.compressorwatch.domain.DetectionResult;
import com.phillippitts.compressorwatch.domain.DetectionSample;
import com.phillippitts.compressorwatch.domain.IntegrationParams;
import com.phillippitts.compressorwatch.domain.SystemStatus;
import com.phillippitts.compressorwatch.exception.DetectorNotInitializedException;
import com.phillippitts.compressorwatch.service.alert.AlertContext;
import com.phillippitts.compressorwatch.service.alert.AlertDispatcher;
import com.phillippitts.compressorwatch.service.metrics.DetectionMetricsPublisher;
import com.phillippitts.compressorwatch.service.monitoring.DetectionRecord;
import com.phillippitts.compressorwatch.service.monitoring.HealthRecord;
import com.phillippitts.compressorwatch.service.monitoring.MonitoringHistory;
import com.phillippitts.compressorwatch.service.monitoring.MonitoringSnapshot;
import com.phillippitts.compressorwatch.service.monitoring.PerformanceRecord;
import com.phillippitts.compressorwatch.service.scorer.SampleFileStager;
import com.phillippitts.compressorwatch.service.scorer.ScorerClient;
import com.phillippitts.compressorwatch.service.scorer.ScorerCommand;
import com.phillippitts.compressorwatch.service.scorer.ScorerFields;
import com.phillippitts.compressorwatch.service.scorer.ScorerRequest;
import com.phillippitts.compressorwatch.service.scorer.ScorerResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Third stage: fuses baseline and adaptive outputs through an ensemble scorer.
 *
 * <p>Besides the shared counters this stage tracks precision, recall and F1, the latest reported
 * reliability and consensus rate, the four monitoring histories and alert evaluation. After each
 * successful detection, in order:
 * <ol>
 *   <li>metrics are updated</li>
 *   <li>detection, performance and health records are appended</li>
 *   <li>every alert rule runs; triggered alerts go to the alert history</li>
 * </ol>
 * All of this happens under the state lock. Alerts are delivered to notification channels
 * after the lock is released.
 */
public class ConsensusEngine extends AbstractDetector {

    private static final Logger LOG = LogManager.getLogger(ConsensusEngine.class);

    private final MonitoringHistory history;
    private final AlertDispatcher alertDispatcher;

    // Guarded by stateLock
    private IntegrationParams params = IntegrationParams.defaults();
    private double systemReliability;
    private double consensusRate;
    private SystemStatus systemStatus = SystemStatus.initial();
    private BaselineDetector baseline;
    private AdaptiveDetector adaptive;

    public ConsensusEngine(ScorerClient scorer, SampleFileStager stager, String modelPath,
                           MonitoringHistory history, AlertDispatcher alertDispatcher,
                           DetectionMetricsPublisher metrics, ApplicationEventPublisher publisher) {
        super(DetectionPhase.CONSENSUS, scorer, stager, modelPath, metrics, publisher);
        this.history = Objects.requireNonNull(history, "history");
        this.alertDispatcher = Objects.requireNonNull(alertDispatcher, "alertDispatcher");
    }

    /**
     * Seeds the ensemble from both upstream artifacts and marks the engine ready.
     * Calling it again replaces the ensemble; metrics and histories are kept.
     *
     * @throws DetectorNotInitializedException if either upstream detector is not ready
     * @throws com.phillippitts.compressorwatch.exception.ScorerException if the scorer fails
     */
    public void initialize(BaselineDetector baselineDetector, AdaptiveDetector adaptiveDetector) {
        Objects.requireNonNull(baselineDetector, "baselineDetector");
        Objects.requireNonNull(adaptiveDetector, "adaptiveDetector");
        if (!baselineDetector.isReady()) {
            throw new DetectorNotInitializedException(baselineDetector.getDetectorName(),
                    "Baseline detector must be trained before initializing the consensus stage");
        }
        if (!adaptiveDetector.isReady()) {
            throw new DetectorNotInitializedException(adaptiveDetector.getDetectorName(),
                    "Adaptive detector must be initialized before initializing the consensus stage");
        }
        runSetup("initialize", () -> {
            callScorer(ScorerRequest.builder(ScorerCommand.INITIALIZE)
                    .field(ScorerFields.MODEL_PATH, modelPath)
                    .field(ScorerFields.BASELINE_MODEL_PATH, baselineDetector.getModelPath())
                    .field(ScorerFields.ADAPTIVE_MODEL_PATH, adaptiveDetector.getModelPath())
                    .field(ScorerFields.PARAMS, currentParams().asMap())
                    .build());
            stateLock.lock();
            try {
                // upstream references must be visible before READY is
                baseline = baselineDetector;
                adaptive = adaptiveDetector;
                markReady();
                systemStatus = SystemStatus.of(baselineDetector.isReady(), adaptiveDetector.isReady(), true,
                        Instant.now());
                return systemStatus;
            } finally {
                stateLock.unlock();
            }
        });
    }

    /**
     * Scores one sample through the ensemble. Never throws for scorer problems.
     *
     * @param groundTruth true when the sample is known anomalous, null when unknown
     */
    public DetectionResult detectIntegrated(DetectionSample sample, Boolean groundTruth) {
        return runDetection(sample, groundTruth, audioPath -> {
            // read after the readiness check so the upstream references are already published
            IntegrationParams snapshot;
            String baselinePath;
            String adaptivePath;
            stateLock.lock();
            try {
                snapshot = params;
                baselinePath = baseline != null ? baseline.getModelPath() : null;
                adaptivePath = adaptive != null ? adaptive.getModelPath() : null;
            } finally {
                stateLock.unlock();
            }
            return ScorerRequest.builder(ScorerCommand.DETECT)
                    .field(ScorerFields.MODEL_PATH, modelPath)
                    .field(ScorerFields.AUDIO_PATH, audioPath.toAbsolutePath().toString())
                    .field(ScorerFields.SAMPLE_RATE, sample.sampleRate())
                    .field(ScorerFields.GROUND_TRUTH, groundTruth)
                    .field(ScorerFields.PARAMS, snapshot.asMap())
                    .field(ScorerFields.BASELINE_MODEL_PATH, baselinePath)
                    .field(ScorerFields.ADAPTIVE_MODEL_PATH, adaptivePath)
                    .build();
        });
    }

    /**
     * Applies the in-range subset of {@code partial} and, when ready, forwards it to the scorer.
     *
     * @return the applied subset (empty when nothing was applied)
     * @throws com.phillippitts.compressorwatch.exception.ScorerException if forwarding fails
     */
    public Map<String, Double> updateIntegrationParams(Map<String, Double> partial) {
        Map<String, Double> applied = IntegrationParams.acceptedFields(partial);
        if (applied.isEmpty()) {
            LOG.info("Integration parameter update applied no fields (requested={})",
                    partial == null ? 0 : partial.size());
            return applied;
        }
        return runSetup("update integration parameters " + applied.keySet(), () -> {
            stateLock.lock();
            try {
                params = params.merge(applied);
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
     * Asks the scorer to persist the ensemble and integration parameters.
     *
     * @throws DetectorNotInitializedException if this engine is not ready
     */
    public void save() {
        if (!isReady()) {
            throw new DetectorNotInitializedException(getDetectorName());
        }
        IntegrationParams snapshot = currentParams();
        runSetup("save", () -> callScorer(ScorerRequest.builder(ScorerCommand.SAVE)
                .field(ScorerFields.MODEL_PATH, modelPath)
                .field(ScorerFields.PARAMS, snapshot.asMap())
                .build()));
    }

    public IntegrationParams currentParams() {
        stateLock.lock();
        try {
            return params;
        } finally {
            stateLock.unlock();
        }
    }

    public IntegratedStats getIntegratedStats() {
        stateLock.lock();
        try {
            return new IntegratedStats(counters.snapshot(), counters.anomalyRate(), systemReliability,
                    consensusRate, systemStatus, params, history.sizes());
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * @param limit maximum entries per history; non-positive values yield empty histories
     * @return last {@code limit} entries of each history, oldest first
     */
    public MonitoringSnapshot getMonitoringData(int limit) {
        stateLock.lock();
        try {
            return history.lastN(limit);
        } finally {
            stateLock.unlock();
        }
    }

    public SystemStatus getSystemStatus() {
        stateLock.lock();
        try {
            return systemStatus;
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Recomputes the readiness flags from the upstream detectors and stamps the check time.
     */
    public SystemStatus refreshSystemStatus() {
        stateLock.lock();
        try {
            boolean phase1 = baseline != null && baseline.isReady();
            boolean phase2 = adaptive != null && adaptive.isReady();
            systemStatus = SystemStatus.of(phase1, phase2, isReady(), Instant.now());
            return systemStatus;
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Clears metrics and all four histories. Parameters and readiness are kept.
     */
    public void reset() {
        stateLock.lock();
        try {
            counters.reset();
            systemReliability = 0.0;
            consensusRate = 0.0;
            history.clear();
        } finally {
            stateLock.unlock();
        }
        LOG.info("Consensus engine metrics and monitoring history reset");
    }

    @Override
    protected DetectionResult toResult(ScorerResponse response, long processingTimeMs) {
        return new DetectionResult(response.anomalous(), response.confidence(), response.anomalyScore(),
                response.anomalyType(), response.reliability(), response.consensusRate(), response.message(),
                processingTimeMs, phase, Instant.now());
    }

    @Override
    protected List<Alert> recordOutcome(DetectionResult result, Boolean groundTruth) {
        counters.recordDetection(result.anomalous(), result.processingTimeMs(), result.timestamp());
        if (groundTruth != null) {
            counters.recordGroundTruth(result.anomalous(), groundTruth);
        }
        double reliability = result.reliability() != null ? result.reliability() : 0.0;
        systemReliability = reliability;
        consensusRate = result.consensusRate() != null ? result.consensusRate() : 0.0;

        Instant now = result.timestamp();
        history.detections().add(new DetectionRecord(now, result.anomalous(), result.confidence(),
                result.anomalyType(), reliability, result.processingTimeMs(), groundTruth));
        history.performance().add(new PerformanceRecord(now, counters.accuracy(), result.processingTimeMs(),
                counters.anomalyRate()));
        history.health().add(new HealthRecord(now, systemStatus.phase1Ready(), systemStatus.phase2Ready(),
                systemStatus.integratedReady(), systemStatus.overallReady(), reliability));

        if (!alertDispatcher.isEnabled()) {
            return List.of();
        }
        List<Alert> raised = alertDispatcher.evaluate(new AlertContext(history.performance().snapshot(),
                history.detections().snapshot(), counters.accuracy(), counters.averageProcessingTimeMs()));
        for (Alert alert : raised) {
            history.alerts().add(alert);
        }
        return raised;
    }

    @Override
    protected void afterOutcome(DetectionResult result, List<Alert> raised) {
        for (Alert alert : raised) {
            alertDispatcher.dispatch(getDetectorName(), alert);
        }
    }
}
