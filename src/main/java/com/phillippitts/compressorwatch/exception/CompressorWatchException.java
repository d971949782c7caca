package com.phillippitts.compressorwatch.exception;

/**
 * Base exception for all compressorwatch application-specific errors.
 * All domain exceptions extend this class so the REST boundary can handle them in one place.
 */
public class CompressorWatchException extends RuntimeException {

    public CompressorWatchException(String message) {
        super(message);
    }

    public CompressorWatchException(String message, Throwable cause) {
        super(message, cause);
    }

    public CompressorWatchException(Throwable cause) {
        super(cause);
    }
}
