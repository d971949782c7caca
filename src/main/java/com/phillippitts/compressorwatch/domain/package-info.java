/**
 * Immutable domain models of the detection engine.
 *
 * <p>All types are records or enums and validate themselves on construction:
 * <ul>
 *   <li>{@link com.phillippitts.compressorwatch.domain.DetectionSample} - audio payload to score</li>
 *   <li>{@link com.phillippitts.compressorwatch.domain.DetectionResult} - decision of one stage</li>
 *   <li>{@link com.phillippitts.compressorwatch.domain.PerformanceMetrics} - counters and rates</li>
 *   <li>{@link com.phillippitts.compressorwatch.domain.AdaptationParams} and
 *       {@link com.phillippitts.compressorwatch.domain.IntegrationParams} - tunables with
 *       validate-and-filter partial updates</li>
 *   <li>{@link com.phillippitts.compressorwatch.domain.SystemStatus} and
 *       {@link com.phillippitts.compressorwatch.domain.Alert}</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.compressorwatch.domain;
