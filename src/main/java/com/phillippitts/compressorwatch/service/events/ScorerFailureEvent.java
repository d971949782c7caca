package com.phillippitts.compressorwatch.service.events;

import java.time.Instant;
import java.util.Map;

/**
 * Published when a scorer call fails (timeout, non-zero exit, malformed output, success=false).
 *
 * <p>Never carries sample bytes. Context is restricted to technical diagnostics.
 */
public record ScorerFailureEvent(
        String detector,
        Instant at,
        String command,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public ScorerFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
