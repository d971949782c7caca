package com.phillippitts.compressorwatch.domain;

import java.time.Instant;

/**
 * Readiness of the detector chain as seen by the consensus stage.
 *
 * @param lastHealthCheck when the flags were last refreshed, null if never
 */
public record SystemStatus(
        boolean phase1Ready,
        boolean phase2Ready,
        boolean integratedReady,
        boolean overallReady,
        Instant lastHealthCheck
) {

    /**
     * Builds a status whose {@code overallReady} is the conjunction of the three flags.
     */
    public static SystemStatus of(boolean phase1Ready, boolean phase2Ready, boolean integratedReady,
                                  Instant checkedAt) {
        return new SystemStatus(phase1Ready, phase2Ready, integratedReady,
                phase1Ready && phase2Ready && integratedReady, checkedAt);
    }

    public static SystemStatus initial() {
        return of(false, false, false, null);
    }
}
