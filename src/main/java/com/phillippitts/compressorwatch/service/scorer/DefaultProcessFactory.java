package com.phillippitts.compressorwatch.service.scorer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Default production implementation of {@link ProcessFactory} using {@link ProcessBuilder}.
 */
final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        // stdout carries the JSON protocol; stderr is captured separately for diagnostics
        pb.redirectErrorStream(false);
        return pb.start();
    }
}
