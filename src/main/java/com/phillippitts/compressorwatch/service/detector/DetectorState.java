package com.phillippitts.compressorwatch.service.detector;

/**
 * Readiness of one detector. A detector moves to {@link #READY} after a successful train or
 * initialize and stays there for the rest of the process lifetime.
 */
public enum DetectorState {
    UNINITIALIZED,
    READY
}
