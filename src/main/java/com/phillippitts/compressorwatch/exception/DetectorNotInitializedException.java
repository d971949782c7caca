package com.phillippitts.compressorwatch.exception;

/**
 * Thrown by setup operations that require an upstream (or the same) detector to be ready.
 * Detection paths never throw this; they return a soft result instead.
 */
public class DetectorNotInitializedException extends CompressorWatchException {

    private final String detectorName;

    public DetectorNotInitializedException(String detectorName) {
        super("Detector not initialized: " + detectorName);
        this.detectorName = detectorName;
    }

    public DetectorNotInitializedException(String detectorName, String message) {
        super(message + " (detector: " + detectorName + ")");
        this.detectorName = detectorName;
    }

    public String getDetectorName() {
        return detectorName;
    }
}
