package com.phillippitts.compressorwatch.service.alert;

import com.phillippitts.compressorwatch.service.monitoring.DetectionRecord;
import com.phillippitts.compressorwatch.service.monitoring.PerformanceRecord;

import java.util.List;

/**
 * Inputs available to alert rules after one integrated detection.
 *
 * @param performanceHistory       full performance history, oldest first
 * @param detectionHistory         full detection history, oldest first
 * @param currentAccuracy          engine accuracy after the detection
 * @param averageProcessingTimeMs  engine mean processing time after the detection
 */
public record AlertContext(
        List<PerformanceRecord> performanceHistory,
        List<DetectionRecord> detectionHistory,
        double currentAccuracy,
        double averageProcessingTimeMs
) {
    public AlertContext {
        performanceHistory = List.copyOf(performanceHistory);
        detectionHistory = List.copyOf(detectionHistory);
    }

    static <T> List<T> tail(List<T> items, int window) {
        return items.subList(items.size() - window, items.size());
    }
}
