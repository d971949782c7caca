package com.phillippitts.compressorwatch.exception;

/**
 * Thrown when the external scoring collaborator fails: process could not start,
 * exited non-zero, timed out, or reported {@code success=false}.
 */
public class ScorerException extends CompressorWatchException {

    private final String detectorName;

    public ScorerException(String message) {
        super(message);
        this.detectorName = "unknown";
    }

    public ScorerException(String message, String detectorName) {
        super(message + " (detector: " + detectorName + ")");
        this.detectorName = detectorName;
    }

    public ScorerException(String message, Throwable cause) {
        super(message, cause);
        this.detectorName = "unknown";
    }

    public ScorerException(String message, String detectorName, Throwable cause) {
        super(message + " (detector: " + detectorName + ")", cause);
        this.detectorName = detectorName;
    }

    public String getDetectorName() {
        return detectorName;
    }
}
