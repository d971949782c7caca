package com.phillippitts.compressorwatch.presentation.exception;

import com.phillippitts.compressorwatch.exception.DetectorNotInitializedException;
import com.phillippitts.compressorwatch.exception.ScorerException;
import com.phillippitts.compressorwatch.exception.ValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler(ValidationException.class)
    ResponseEntity<ApiError> handleValidation(ValidationException ex) {
        LOG.warn("Validation failed: field={}, reason={}", ex.getField(), ex.getReason());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid request",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Malformed body or query parameter (HTTP 400).
     */
    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class
    })
    ResponseEntity<ApiError> handleMalformedRequest(Exception ex) {
        LOG.warn("Malformed request: {}", ex.getClass().getSimpleName());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "MalformedRequest",
                "Invalid request",
                "Request body or parameters could not be read",
                Instant.now()
            ));
    }

    /**
     * Lifecycle conflict - upstream stage not ready (HTTP 409).
     */
    @ExceptionHandler(DetectorNotInitializedException.class)
    ResponseEntity<ApiError> handleNotInitialized(DetectorNotInitializedException ex) {
        LOG.warn("Detector not initialized: detector={}", ex.getDetectorName());
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Detector not initialized",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Transient error - retry possible (HTTP 503).
     */
    @ExceptionHandler(ScorerException.class)
    ResponseEntity<ApiError> handleScorerFailure(ScorerException ex) {
        LOG.error("Scorer failed: detector={}", ex.getDetectorName(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Scoring service temporarily unavailable",
                "Please retry later",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
