package com.phillippitts.compressorwatch.service.scorer;

import java.time.Duration;
import java.util.Objects;

/**
 * Timeout policy for scorer calls: detection commands get {@code detect}, every other command
 * gets {@code setup}.
 */
public record ScorerTimeouts(Duration detect, Duration setup) {

    public ScorerTimeouts {
        Objects.requireNonNull(detect, "detect");
        Objects.requireNonNull(setup, "setup");
        if (detect.isNegative() || detect.isZero() || setup.isNegative() || setup.isZero()) {
            throw new IllegalArgumentException("scorer timeouts must be positive");
        }
    }

    public Duration forCommand(ScorerCommand command) {
        return command.isDetection() ? detect : setup;
    }
}
