package com.phillippitts.compressorwatch.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.compressorwatch.domain.DetectionResult;

import java.time.Instant;

/**
 * Wire form of a {@link DetectionResult}. {@code phase} is the stage number (1, 2 or 3);
 * reliability and consensus rate are omitted outside the consensus stage.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DetectionResponse(
        @JsonProperty("isAnomaly") boolean anomalous,
        double confidence,
        double anomalyScore,
        String anomalyType,
        Double reliability,
        Double consensusRate,
        String message,
        long processingTimeMs,
        int phase,
        Instant timestamp
) {

    public static DetectionResponse from(DetectionResult result) {
        return new DetectionResponse(result.anomalous(), result.confidence(), result.anomalyScore(),
                result.anomalyType(), result.reliability(), result.consensusRate(), result.message(),
                result.processingTimeMs(), result.phase().number(), result.timestamp());
    }
}
