package com.phillippitts.compressorwatch.service.alert;

import com.phillippitts.compressorwatch.domain.Alert;
import com.phillippitts.compressorwatch.domain.AlertSeverity;
import com.phillippitts.compressorwatch.service.monitoring.PerformanceRecord;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Warns when the mean processing time of the last {@code window} detections exceeds the overall
 * mean by more than {@code factor}.
 */
public final class ProcessingTimeIncreaseRule implements AlertRule {

    public static final String TYPE = "processing_time_increase";

    private final int window;
    private final double factor;

    public ProcessingTimeIncreaseRule(int window, double factor) {
        if (window <= 0) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.window = window;
        this.factor = factor;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Optional<Alert> evaluate(AlertContext context) {
        List<PerformanceRecord> history = context.performanceHistory();
        if (history.size() < window) {
            return Optional.empty();
        }
        double recentMs = AlertContext.tail(history, window).stream()
                .mapToLong(PerformanceRecord::processingTimeMs)
                .sum() / (double) window;
        if (recentMs > context.averageProcessingTimeMs() * factor) {
            return Optional.of(Alert.of(TYPE,
                    String.format(Locale.ROOT, "Processing time increase detected: %.1fms", recentMs),
                    AlertSeverity.WARNING));
        }
        return Optional.empty();
    }
}
