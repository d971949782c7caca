package com.phillippitts.compressorwatch.service.alert;

import com.phillippitts.compressorwatch.domain.Alert;
import com.phillippitts.compressorwatch.domain.AlertSeverity;
import com.phillippitts.compressorwatch.service.monitoring.DetectionRecord;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Raises a critical alert when the anomalous fraction of the last {@code window} detections
 * exceeds {@code maxRate}.
 */
public final class AnomalyRateSpikeRule implements AlertRule {

    public static final String TYPE = "anomaly_rate_spike";

    private final int window;
    private final double maxRate;

    public AnomalyRateSpikeRule(int window, double maxRate) {
        if (window <= 0) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.window = window;
        this.maxRate = maxRate;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Optional<Alert> evaluate(AlertContext context) {
        List<DetectionRecord> history = context.detectionHistory();
        if (history.size() < window) {
            return Optional.empty();
        }
        long anomalous = AlertContext.tail(history, window).stream()
                .filter(DetectionRecord::anomalous)
                .count();
        double rate = (double) anomalous / window;
        if (rate > maxRate) {
            return Optional.of(Alert.of(TYPE,
                    String.format(Locale.ROOT, "Anomaly rate spike: %.1f%%", rate * 100),
                    AlertSeverity.CRITICAL));
        }
        return Optional.empty();
    }
}
