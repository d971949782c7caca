/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.compressorwatch.exception.CompressorWatchException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.compressorwatch.exception.ValidationException} - Thrown when
 *       setup input is unusable (empty training set, bad sample rate)</li>
 *   <li>{@link com.phillippitts.compressorwatch.exception.DetectorNotInitializedException} - Thrown
 *       when a setup operation needs a detector that is not ready</li>
 *   <li>{@link com.phillippitts.compressorwatch.exception.ScorerException} - Thrown when the
 *       external scorer crashes, times out or reports failure</li>
 *   <li>{@link com.phillippitts.compressorwatch.exception.ScorerOutputException} - Thrown when the
 *       scorer output cannot be parsed</li>
 * </ul>
 *
 * <p>Detection paths never let these escape; they are converted into soft
 * {@link com.phillippitts.compressorwatch.domain.DetectionResult}s. Setup paths propagate them to
 * the caller and {@code GlobalExceptionHandler} maps them to HTTP status codes.
 *
 * @since 1.0
 */
package com.phillippitts.compressorwatch.exception;
