package com.phillippitts.compressorwatch.service.detector;

import com.phillippitts.compressorwatch.domain.Alert;
import com.phillippitts.compressorwatch.domain.AnomalyTypes;
import com.phillippitts.compressorwatch.domain.DetectionPhase;
import com.phillippitts.compressorwatch.domain.DetectionResult;
import com.phillippitts.compressorwatch.domain.DetectionSample;
import com.phillippitts.compressorwatch.exception.ScorerException;
import com.phillippitts.compressorwatch.exception.ScorerExceptionBuilder;
import com.phillippitts.compressorwatch.exception.ValidationException;
import com.phillippitts.compressorwatch.service.events.ScorerEventPublisher;
import com.phillippitts.compressorwatch.service.metrics.DetectionMetricsPublisher;
import com.phillippitts.compressorwatch.service.scorer.SampleFileStager;
import com.phillippitts.compressorwatch.service.scorer.ScorerClient;
import com.phillippitts.compressorwatch.service.scorer.ScorerCommand;
import com.phillippitts.compressorwatch.service.scorer.ScorerRequest;
import com.phillippitts.compressorwatch.service.scorer.ScorerResponse;
import com.phillippitts.compressorwatch.util.LogSanitizer;
import com.phillippitts.compressorwatch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Base class for the three detector stages providing lifecycle, locking and the fail-soft
 * detection template.
 *
 * <p><b>Thread Safety:</b> Two locks per instance.
 * <ul>
 *   <li>{@link #stateLock} guards counters, parameters and any other mutable state. It is held
 *       only for in-memory updates, never across a scorer call, so concurrent detections
 *       overlap on the scorer and serialize only on bookkeeping.</li>
 *   <li>{@link #setupLock} serializes train, initialize, parameter forwarding, forced re-fit and
 *       save on one instance. Re-running a setup operation replaces the model; counters are
 *       kept.</li>
 * </ul>
 * Instances never share locks, so a call on one detector never blocks another.
 *
 * <p><b>Failure contract:</b> detection methods never throw for scorer problems; they return a
 * soft {@link DetectionResult}. Setup methods propagate {@link ScorerException}.
 *
 * <p><b>Subclass Responsibilities:</b>
 * <ul>
 *   <li>{@link #recordOutcome(DetectionResult, Boolean)} - bookkeeping under the state lock</li>
 * </ul>
 */
public abstract class AbstractDetector {

    private static final Logger LOG = LogManager.getLogger(AbstractDetector.class);

    private static final int SOFT_MESSAGE_MAX_CHARS = 300;

    /** Guards all mutable bookkeeping of the detector. */
    protected final ReentrantLock stateLock = new ReentrantLock();

    /** Serializes setup operations on this instance. */
    protected final ReentrantLock setupLock = new ReentrantLock();

    protected final DetectionPhase phase;
    protected final ScorerClient scorer;
    protected final SampleFileStager stager;
    protected final String modelPath;
    protected final DetectionMetricsPublisher metrics;
    protected final ApplicationEventPublisher publisher;

    /** Running counters; access under {@link #stateLock}. */
    protected final DetectionCounters counters = new DetectionCounters();

    private volatile DetectorState state = DetectorState.UNINITIALIZED;

    protected AbstractDetector(DetectionPhase phase,
                               ScorerClient scorer,
                               SampleFileStager stager,
                               String modelPath,
                               DetectionMetricsPublisher metrics,
                               ApplicationEventPublisher publisher) {
        this.phase = Objects.requireNonNull(phase, "phase");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.stager = Objects.requireNonNull(stager, "stager");
        this.modelPath = Objects.requireNonNull(modelPath, "modelPath");
        this.metrics = metrics != null ? metrics : DetectionMetricsPublisher.NOOP;
        this.publisher = publisher;
    }

    public final String getDetectorName() {
        return phase.detectorName();
    }

    public final DetectionPhase getPhase() {
        return phase;
    }

    public final DetectorState getState() {
        return state;
    }

    public final boolean isReady() {
        return state == DetectorState.READY;
    }

    /**
     * @return model artifact location handed to downstream stages
     */
    public final String getModelPath() {
        return modelPath;
    }

    public DetectorStatus getStatus() {
        stateLock.lock();
        try {
            return new DetectorStatus(getDetectorName(), state, modelPath, counters.snapshot());
        } finally {
            stateLock.unlock();
        }
    }

    protected final void markReady() {
        state = DetectorState.READY;
    }

    /**
     * Anomaly type returned when a detection is attempted before the detector is ready.
     */
    protected String notReadyType() {
        return AnomalyTypes.SYSTEM_NOT_INITIALIZED;
    }

    /**
     * Runs a setup operation under the setup lock with the detector name in the logging context.
     */
    protected final <T> T runSetup(String operation, Supplier<T> work) {
        setupLock.lock();
        ThreadContext.put("detector", getDetectorName());
        try {
            LOG.info("Detector {}: {} started", getDetectorName(), operation);
            long start = System.nanoTime();
            T result = work.get();
            LOG.info("Detector {}: {} completed in {} ms", getDetectorName(), operation,
                    TimeUtils.elapsedMillis(start));
            return result;
        } finally {
            ThreadContext.remove("detector");
            setupLock.unlock();
        }
    }

    /**
     * Sends a request to the scorer, publishing a failure event before rethrowing.
     */
    protected final ScorerResponse callScorer(ScorerRequest request) {
        try {
            return scorer.call(request);
        } catch (ScorerException e) {
            ScorerEventPublisher.publishFailure(publisher, getDetectorName(), request.command().wireName(), e,
                    Map.of("phase", String.valueOf(phase.number())));
            throw e;
        }
    }

    /**
     * Stages the samples, then runs {@code call} with their paths. Staging failures surface as
     * {@link ScorerException} so setup callers see one failure type.
     */
    protected final <T> T withStagedSamples(List<DetectionSample> samples, ScorerCommand command,
                                            Function<SampleFileStager.StagedSamples, T> call) {
        try (SampleFileStager.StagedSamples staged = stage(samples, command)) {
            return call.apply(staged);
        }
    }

    private SampleFileStager.StagedSamples stage(List<DetectionSample> samples, ScorerCommand command) {
        try {
            return stager.stage(samples);
        } catch (IOException e) {
            throw ScorerExceptionBuilder.create("Failed to stage samples: " + e.getMessage())
                    .detector(getDetectorName())
                    .command(command.wireName())
                    .cause(e)
                    .build();
        }
    }

    /**
     * Fail-soft detection template.
     *
     * <ol>
     *   <li>Not ready: returns a soft result with {@link #notReadyType()}; counters untouched.</li>
     *   <li>Stages the sample, builds the request via {@code requestFactory} and calls the scorer
     *       outside any lock.</li>
     *   <li>Scorer or staging failure: returns a soft {@link AnomalyTypes#ERROR} result; counters
     *       untouched.</li>
     *   <li>Success: builds the result and calls {@link #recordOutcome} under the state lock,
     *       then {@link #afterOutcome} outside it.</li>
     * </ol>
     *
     * @param sample sample to score (must not be null)
     * @param groundTruth caller-supplied label, may be null
     * @param requestFactory builds the scorer request from the staged audio path
     * @throws ValidationException if {@code sample} is null
     */
    protected final DetectionResult runDetection(DetectionSample sample, Boolean groundTruth,
                                                 Function<Path, ScorerRequest> requestFactory) {
        if (sample == null) {
            throw new ValidationException("sample", "must not be null");
        }
        long start = System.nanoTime();
        ThreadContext.put("detector", getDetectorName());
        try {
            if (!isReady()) {
                DetectionResult soft = DetectionResult.softFailure(phase, notReadyType(),
                        getDetectorName() + " detector is not initialized", 0L);
                metrics.recordDetection(soft, System.nanoTime() - start);
                return soft;
            }

            ScorerResponse response;
            try {
                response = withStagedSamples(List.of(sample), ScorerCommand.DETECT,
                        staged -> callScorer(requestFactory.apply(staged.first())));
            } catch (ScorerException e) {
                long elapsed = TimeUtils.elapsedMillis(start);
                LOG.warn("Detector {}: detection failed after {} ms: {}", getDetectorName(), elapsed, e.getMessage());
                DetectionResult soft = DetectionResult.softFailure(phase, AnomalyTypes.ERROR,
                        "Detection failed: " + LogSanitizer.truncate(e.getMessage(), SOFT_MESSAGE_MAX_CHARS),
                        elapsed);
                metrics.recordDetection(soft, System.nanoTime() - start);
                return soft;
            }

            long durationNanos = System.nanoTime() - start;
            DetectionResult result = toResult(response, TimeUtils.nanosToMillis(durationNanos));
            List<Alert> raised;
            stateLock.lock();
            try {
                raised = recordOutcome(result, groundTruth);
            } finally {
                stateLock.unlock();
            }
            afterOutcome(result, raised);
            metrics.recordDetection(result, durationNanos);
            LOG.debug("Detector {}: anomalous={}, confidence={}, type={}, {} ms", getDetectorName(),
                    result.anomalous(), result.confidence(), result.anomalyType(), result.processingTimeMs());
            return result;
        } finally {
            ThreadContext.remove("detector");
        }
    }

    /**
     * Maps a scorer response to a result of this stage. Reliability and consensus rate are kept
     * only by the consensus stage.
     */
    protected DetectionResult toResult(ScorerResponse response, long processingTimeMs) {
        return new DetectionResult(response.anomalous(), response.confidence(), response.anomalyScore(),
                response.anomalyType(), null, null, response.message(), processingTimeMs, phase, Instant.now());
    }

    /**
     * Updates bookkeeping for a successful detection. Called with {@link #stateLock} held.
     *
     * @return alerts raised by this detection, handed to {@link #afterOutcome}; may be empty
     */
    protected abstract List<Alert> recordOutcome(DetectionResult result, Boolean groundTruth);

    /**
     * Hook run after the state lock is released. Default does nothing.
     */
    protected void afterOutcome(DetectionResult result, List<Alert> raised) {
    }
}
