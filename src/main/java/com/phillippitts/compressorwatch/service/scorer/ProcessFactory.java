package com.phillippitts.compressorwatch.service.scorer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} to enable hermetic testing of scorer transports.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests provide a stub returning a fake
 * {@link Process} with controlled stdin/stdout/stderr/exit behavior.
 */
interface ProcessFactory {
    /**
     * Starts a new process with the given command and working directory.
     *
     * @param command full command line, with the executable as the first element
     * @param workingDir working directory for the process (may be null)
     * @return started {@link Process}
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
