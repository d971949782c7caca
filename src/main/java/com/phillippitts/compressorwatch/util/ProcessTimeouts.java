package com.phillippitts.compressorwatch.util;

import java.time.Duration;

/**
 * Standard timeout values for scorer process and stream-reader thread management.
 *
 * <p>Scorer call deadlines themselves are configured through {@code scorer.detect-timeout} and
 * {@code scorer.setup-timeout}; the values here only bound cleanup after a call has ended.
 *
 * @see com.phillippitts.compressorwatch.service.scorer.ScorerProcessManager
 * @see com.phillippitts.compressorwatch.service.scorer.ScorerWorker
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Time for stream gobbler threads to flush buffered output after the process exits.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Best-effort gobbler join during cleanup. Gobblers are daemon threads.
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Grace period after {@link Process#destroy()} before escalating.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Deadline for {@link Process#destroyForcibly()} to take effect.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
