package com.phillippitts.compressorwatch.service.scorer;

import com.phillippitts.compressorwatch.exception.ScorerExceptionBuilder;

/**
 * Parsed scorer decision record. Numeric fields are already clamped to [0, 1].
 *
 * @param reliability   null when the scorer did not report it
 * @param consensusRate from {@code consensusInfo.consensusRate}; null when absent
 * @param message       scorer-provided note, may be null
 */
public record ScorerResponse(
        boolean success,
        boolean anomalous,
        double confidence,
        double anomalyScore,
        String anomalyType,
        Double reliability,
        Double consensusRate,
        String message
) {

    /**
     * Returns this response, or throws when the scorer reported {@code success=false}.
     *
     * @throws com.phillippitts.compressorwatch.exception.ScorerException if not successful
     */
    public ScorerResponse requireSuccess(String detectorName, ScorerCommand command) {
        if (!success) {
            throw ScorerExceptionBuilder.create("Scorer reported failure")
                    .detector(detectorName)
                    .command(command.wireName())
                    .metadata("message", message)
                    .build();
        }
        return this;
    }
}
