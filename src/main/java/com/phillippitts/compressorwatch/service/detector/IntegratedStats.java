package com.phillippitts.compressorwatch.service.detector;

import com.phillippitts.compressorwatch.domain.IntegrationParams;
import com.phillippitts.compressorwatch.domain.PerformanceMetrics;
import com.phillippitts.compressorwatch.domain.SystemStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Consensus-stage statistics.
 *
 * @param systemReliability   reliability reported by the latest detection
 * @param consensusRate       consensus rate reported by the latest detection
 * @param monitoringDataSize  entry count per monitoring history
 */
public record IntegratedStats(
        PerformanceMetrics metrics,
        double anomalyRate,
        double systemReliability,
        double consensusRate,
        SystemStatus systemStatus,
        IntegrationParams integrationParams,
        Map<String, Integer> monitoringDataSize
) {
    public IntegratedStats {
        monitoringDataSize = Collections.unmodifiableMap(new LinkedHashMap<>(monitoringDataSize));
    }
}
