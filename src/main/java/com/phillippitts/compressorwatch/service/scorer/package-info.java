/**
 * Transport to the external anomaly scorer.
 *
 * <p>A scorer is an external executable that reads one JSON request and answers with one JSON
 * object. Two transports are provided:
 * <ul>
 *   <li>{@link com.phillippitts.compressorwatch.service.scorer.PooledScorerClient}: persistent
 *       worker processes started with {@code --serve}, one request per line</li>
 *   <li>{@link com.phillippitts.compressorwatch.service.scorer.PerCallScorerClient}: one process
 *       per call</li>
 * </ul>
 *
 * <p>Every call is bounded by {@link com.phillippitts.compressorwatch.service.scorer.ScorerTimeouts}.
 */
package com.phillippitts.compressorwatch.service.scorer;
