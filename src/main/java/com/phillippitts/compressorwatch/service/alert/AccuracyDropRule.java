package com.phillippitts.compressorwatch.service.alert;

import com.phillippitts.compressorwatch.domain.Alert;
import com.phillippitts.compressorwatch.domain.AlertSeverity;
import com.phillippitts.compressorwatch.service.monitoring.PerformanceRecord;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Warns when the mean accuracy of the last {@code window} performance records falls more than
 * {@code drop} below the current overall accuracy.
 */
public final class AccuracyDropRule implements AlertRule {

    public static final String TYPE = "accuracy_drop";

    private final int window;
    private final double drop;

    public AccuracyDropRule(int window, double drop) {
        if (window <= 0) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.window = window;
        this.drop = drop;
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
        double recentAccuracy = AlertContext.tail(history, window).stream()
                .mapToDouble(PerformanceRecord::accuracy)
                .sum() / window;
        if (recentAccuracy < context.currentAccuracy() - drop) {
            return Optional.of(Alert.of(TYPE,
                    String.format(Locale.ROOT, "Accuracy drop detected: %.1f%%", recentAccuracy * 100),
                    AlertSeverity.WARNING));
        }
        return Optional.empty();
    }
}
