package com.phillippitts.compressorwatch.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for detector calls and raised alerts.
 *
 * <p>Provides:
 * <ul>
 *   <li>Detection latency per phase (baseline, adaptive, consensus)</li>
 *   <li>Success/failure counts per phase, failures tagged with the soft-failure type</li>
 *   <li>Alert counts per rule type and severity</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class DetectionMetrics {

    private static final String METRIC_PREFIX = "compressorwatch.detection";
    private static final String ALERTS_METRIC = "compressorwatch.alerts";

    private final MeterRegistry registry;

    public DetectionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordLatency(String phase, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Wall-clock time of one detection call")
                .tag("phase", phase)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String phase, boolean anomalous) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of completed detections")
                .tag("phase", phase)
                .tag("anomalous", Boolean.toString(anomalous))
                .register(registry)
                .increment();
    }

    /**
     * @param reason soft-failure anomaly type (error, model_not_initialized, system_not_initialized)
     */
    public void incrementFailure(String phase, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of detections that returned a soft failure")
                .tag("phase", phase)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementAlert(String type, String severity) {
        Counter.builder(ALERTS_METRIC)
                .description("Number of alerts raised by the consensus stage")
                .tag("type", type)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }
}
