package com.phillippitts.compressorwatch.service.metrics;

import com.phillippitts.compressorwatch.domain.Alert;
import com.phillippitts.compressorwatch.domain.DetectionResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Null-safe facade over {@link DetectionMetrics} used by the detectors.
 *
 * <p>All methods are no-ops when constructed without metrics, so detectors run unchanged in
 * unit tests.
 */
@Component
public final class DetectionMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(DetectionMetricsPublisher.class);

    /** Shared no-op instance for tests and defaults. */
    public static final DetectionMetricsPublisher NOOP = new DetectionMetricsPublisher(null);

    private final DetectionMetrics metrics;

    public DetectionMetricsPublisher(DetectionMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("DetectionMetricsPublisher created without metrics (test mode)");
        }
    }

    /**
     * Records latency plus a success or failure count depending on the result.
     */
    public void recordDetection(DetectionResult result, long durationNanos) {
        if (metrics == null) {
            return;
        }
        String phase = result.phase().detectorName();
        metrics.recordLatency(phase, durationNanos);
        if (result.isFailure()) {
            metrics.incrementFailure(phase, result.anomalyType());
        } else {
            metrics.incrementSuccess(phase, result.anomalous());
        }
    }

    public void recordAlert(Alert alert) {
        if (metrics == null) {
            return;
        }
        metrics.incrementAlert(alert.type(), alert.severity().label());
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
