package com.phillippitts.compressorwatch.service.scorer;

import com.phillippitts.compressorwatch.exception.ScorerException;

/**
 * Request/response boundary to the external scorer of one detector stage.
 *
 * <p>Implementations must be thread-safe and must bound every call by a timeout.
 *
 * @see PerCallScorerClient
 * @see PooledScorerClient
 */
public interface ScorerClient extends AutoCloseable {

    /**
     * Sends one request and returns the successful response.
     *
     * @param request request document
     * @return parsed response with {@code success=true}
     * @throws ScorerException on process failure, timeout, unparseable output
     *         ({@link com.phillippitts.compressorwatch.exception.ScorerOutputException})
     *         or {@code success=false}
     */
    ScorerResponse call(ScorerRequest request);

    /**
     * @return name of the detector stage this client serves
     */
    String detectorName();

    /**
     * Releases any long-lived processes. Idempotent.
     */
    @Override
    void close();
}
