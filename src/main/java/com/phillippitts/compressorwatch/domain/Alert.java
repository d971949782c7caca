package com.phillippitts.compressorwatch.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A raised alert condition.
 *
 * @param type     rule identifier, e.g. {@code anomaly_rate_spike}
 * @param message  human-readable description including the observed value
 * @param severity warning or critical
 * @param timestamp when the rule fired
 */
public record Alert(String type, String message, AlertSeverity severity, Instant timestamp) {

    public Alert {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static Alert of(String type, String message, AlertSeverity severity) {
        return new Alert(type, message, severity, Instant.now());
    }
}
