package com.phillippitts.compressorwatch.exception;

/**
 * Thrown when the scorer exits cleanly but its stdout is not a usable JSON decision record.
 */
public class ScorerOutputException extends ScorerException {

    public ScorerOutputException(String message, String detectorName) {
        super(message, detectorName);
    }

    public ScorerOutputException(String message, String detectorName, Throwable cause) {
        super(message, detectorName, cause);
    }
}
