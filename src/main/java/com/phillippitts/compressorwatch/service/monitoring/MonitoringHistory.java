package com.phillippitts.compressorwatch.service.monitoring;

import com.phillippitts.compressorwatch.domain.Alert;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The four monitoring rings owned by the consensus stage.
 *
 * <p>Each ring is individually thread-safe. Callers that need a consistent view across rings
 * (append-then-evaluate) hold the engine's state lock.
 */
public final class MonitoringHistory {

    public static final String DETECTION_HISTORY = "detectionHistory";
    public static final String PERFORMANCE_HISTORY = "performanceHistory";
    public static final String SYSTEM_HEALTH = "systemHealth";
    public static final String ALERT_HISTORY = "alertHistory";

    private final BoundedRingBuffer<DetectionRecord> detections;
    private final BoundedRingBuffer<PerformanceRecord> performance;
    private final BoundedRingBuffer<HealthRecord> health;
    private final BoundedRingBuffer<Alert> alerts;

    public MonitoringHistory(int detectionCapacity, int performanceCapacity, int healthCapacity, int alertCapacity) {
        this.detections = new BoundedRingBuffer<>(detectionCapacity);
        this.performance = new BoundedRingBuffer<>(performanceCapacity);
        this.health = new BoundedRingBuffer<>(healthCapacity);
        this.alerts = new BoundedRingBuffer<>(alertCapacity);
    }

    public BoundedRingBuffer<DetectionRecord> detections() {
        return detections;
    }

    public BoundedRingBuffer<PerformanceRecord> performance() {
        return performance;
    }

    public BoundedRingBuffer<HealthRecord> health() {
        return health;
    }

    public BoundedRingBuffer<Alert> alerts() {
        return alerts;
    }

    public MonitoringSnapshot lastN(int limit) {
        return new MonitoringSnapshot(detections.lastN(limit), performance.lastN(limit),
                health.lastN(limit), alerts.lastN(limit));
    }

    /**
     * @return current entry count per ring, keyed by history name
     */
    public Map<String, Integer> sizes() {
        Map<String, Integer> sizes = new LinkedHashMap<>();
        sizes.put(DETECTION_HISTORY, detections.size());
        sizes.put(PERFORMANCE_HISTORY, performance.size());
        sizes.put(SYSTEM_HEALTH, health.size());
        sizes.put(ALERT_HISTORY, alerts.size());
        return sizes;
    }

    public void clear() {
        detections.clear();
        performance.clear();
        health.clear();
        alerts.clear();
    }
}
