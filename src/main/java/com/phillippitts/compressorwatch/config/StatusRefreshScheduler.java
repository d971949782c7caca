package com.phillippitts.compressorwatch.config;

import com.phillippitts.compressorwatch.domain.SystemStatus;
import com.phillippitts.compressorwatch.service.detector.ConsensusEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically refreshes the consensus engine's readiness flags.
 */
@Component
class StatusRefreshScheduler {

    private static final Logger LOG = LogManager.getLogger(StatusRefreshScheduler.class);

    private final ConsensusEngine consensusEngine;

    StatusRefreshScheduler(ConsensusEngine consensusEngine) {
        this.consensusEngine = consensusEngine;
    }

    @Scheduled(fixedDelayString = "${monitoring.health-check-interval-ms:60000}",
            initialDelayString = "${monitoring.health-check-interval-ms:60000}")
    void refresh() {
        SystemStatus status = consensusEngine.refreshSystemStatus();
        LOG.debug("System status refreshed: phase1={}, phase2={}, integrated={}, overall={}",
                status.phase1Ready(), status.phase2Ready(), status.integratedReady(), status.overallReady());
    }
}
