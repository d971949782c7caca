package com.phillippitts.compressorwatch.service.detector;

import com.phillippitts.compressorwatch.domain.PerformanceMetrics;

/**
 * Best-known state of one detector. Available even when the detector was never initialized.
 */
public record DetectorStatus(String detector, DetectorState state, String modelPath, PerformanceMetrics metrics) {

    public boolean ready() {
        return state == DetectorState.READY;
    }
}
