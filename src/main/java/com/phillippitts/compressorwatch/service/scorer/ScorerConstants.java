package com.phillippitts.compressorwatch.service.scorer;

/**
 * Constants for scorer process handling.
 */
final class ScorerConstants {

    /** Cap on captured stderr; only used for diagnostics. */
    static final int STDERR_MAX_BYTES = 65_536;

    /** Maximum stderr characters copied into exception messages. */
    static final int ERROR_SNIPPET_MAX_CHARS = 512;

    /** Flag appended to the stage command to start a long-lived worker. */
    static final String SERVE_FLAG = "--serve";

    private ScorerConstants() {}
}
