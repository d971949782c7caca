package com.phillippitts.compressorwatch.service.detector;

import java.time.Instant;

/**
 * Adaptation bookkeeping of the adaptive stage.
 *
 * @param totalAdaptations        completed forced re-fits
 * @param lastAdaptation          completion time of the last re-fit, null if none
 * @param adaptationEffectiveness accuracy on labelled samples seen since the last re-fit
 * @param thresholdUpdates        parameter updates that applied at least one field
 * @param modelUpdates            model replacements (initialize and forced re-fits after the first)
 */
public record AdaptiveStats(
        long totalAdaptations,
        Instant lastAdaptation,
        double adaptationEffectiveness,
        long thresholdUpdates,
        long modelUpdates
) {

    public static AdaptiveStats empty() {
        return new AdaptiveStats(0, null, 0.0, 0, 0);
    }
}
