package com.phillippitts.compressorwatch.exception;

/**
 * Thrown when caller input for a setup operation is unusable: an empty training set,
 * a missing sample, or a non-positive sample rate.
 */
public class ValidationException extends CompressorWatchException {

    private final String field;
    private final String reason;

    public ValidationException(String field, String reason) {
        super("Invalid " + field + ": " + reason);
        this.field = field;
        this.reason = reason;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }
}
