package com.phillippitts.compressorwatch.service.events;

import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;

/**
 * Null-safe publishing of {@link ScorerFailureEvent}s, so detectors work without a Spring
 * context in unit tests.
 */
public final class ScorerEventPublisher {

    private ScorerEventPublisher() {
        // Utility class - prevent instantiation
    }

    /**
     * Publishes a failure event if a publisher is available.
     *
     * @param publisher the Spring event publisher (may be null)
     * @param detector detector whose scorer failed
     * @param command scorer command wire name
     * @param cause the failure (may be null)
     * @param context additional diagnostics (may be null)
     */
    public static void publishFailure(ApplicationEventPublisher publisher,
                                      String detector,
                                      String command,
                                      Throwable cause,
                                      Map<String, String> context) {
        if (publisher != null) {
            String message = cause != null ? cause.getMessage() : "scorer failure";
            publisher.publishEvent(new ScorerFailureEvent(detector, Instant.now(), command, message, cause, context));
        }
    }
}
