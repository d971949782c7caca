package com.phillippitts.compressorwatch.service.monitoring;

import com.phillippitts.compressorwatch.domain.Alert;

import java.util.List;

/**
 * Copy of the four monitoring histories, each oldest first.
 */
public record MonitoringSnapshot(
        List<DetectionRecord> detectionHistory,
        List<PerformanceRecord> performanceHistory,
        List<HealthRecord> systemHealth,
        List<Alert> alertHistory
) {
    public MonitoringSnapshot {
        detectionHistory = List.copyOf(detectionHistory);
        performanceHistory = List.copyOf(performanceHistory);
        systemHealth = List.copyOf(systemHealth);
        alertHistory = List.copyOf(alertHistory);
    }
}
