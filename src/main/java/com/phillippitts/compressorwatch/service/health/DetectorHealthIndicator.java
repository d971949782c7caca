package com.phillippitts.compressorwatch.service.health;

import com.phillippitts.compressorwatch.service.detector.AdaptiveDetector;
import com.phillippitts.compressorwatch.service.detector.BaselineDetector;
import com.phillippitts.compressorwatch.service.detector.ConsensusEngine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the detector chain.
 *
 * <ul>
 *   <li>UP: all three stages ready</li>
 *   <li>DEGRADED: at least one stage ready</li>
 *   <li>DOWN: no stage ready</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class DetectorHealthIndicator implements HealthIndicator {

    private final BaselineDetector baseline;
    private final AdaptiveDetector adaptive;
    private final ConsensusEngine consensus;

    public DetectorHealthIndicator(BaselineDetector baseline, AdaptiveDetector adaptive, ConsensusEngine consensus) {
        this.baseline = baseline;
        this.adaptive = adaptive;
        this.consensus = consensus;
    }

    @Override
    public Health health() {
        boolean phase1 = baseline.isReady();
        boolean phase2 = adaptive.isReady();
        boolean phase3 = consensus.isReady();

        Health.Builder builder = new Health.Builder();
        if (phase1 && phase2 && phase3) {
            builder.up().withDetail("status", "All detector stages ready");
        } else if (phase1 || phase2 || phase3) {
            builder.status("DEGRADED").withDetail("status", "Partial detector availability");
        } else {
            builder.down().withDetail("status", "No detector stage initialized");
        }
        return builder
                .withDetail(baseline.getDetectorName(), describe(phase1))
                .withDetail(adaptive.getDetectorName(), describe(phase2))
                .withDetail(consensus.getDetectorName(), describe(phase3))
                .build();
    }

    private static String describe(boolean ready) {
        return ready ? "ready" : "uninitialized";
    }
}
