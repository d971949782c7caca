package com.phillippitts.compressorwatch.service.scorer;

import com.phillippitts.compressorwatch.domain.DetectionSample;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Writes samples to temporary files the scorer can read by path.
 *
 * <p>Files live only for the duration of one scorer call; {@link StagedSamples#close()} deletes
 * them. Sample bytes are written as-is (the scorer decodes the container format).
 */
public final class SampleFileStager {

    private static final Logger LOG = LogManager.getLogger(SampleFileStager.class);

    private static final String PREFIX = "sample-";
    private static final String SUFFIX = ".wav";

    private final Path workDir;

    /**
     * @param workDir directory for staged files; the system temp directory when null
     */
    public SampleFileStager(Path workDir) {
        this.workDir = workDir;
    }

    public StagedSamples stage(DetectionSample sample) throws IOException {
        return stage(List.of(sample));
    }

    /**
     * Writes each sample to its own temp file. On failure, files written so far are removed.
     *
     * @throws IOException if a file cannot be created or written
     */
    public StagedSamples stage(List<DetectionSample> samples) throws IOException {
        if (workDir != null) {
            Files.createDirectories(workDir);
        }
        List<Path> paths = new ArrayList<>(samples.size());
        try {
            for (DetectionSample sample : samples) {
                Path file = workDir != null
                        ? Files.createTempFile(workDir, PREFIX, SUFFIX)
                        : Files.createTempFile(PREFIX, SUFFIX);
                paths.add(file);
                Files.write(file, sample.audio());
            }
        } catch (IOException e) {
            deleteAll(paths);
            throw e;
        }
        return new StagedSamples(paths);
    }

    private static void deleteAll(List<Path> paths) {
        for (Path p : paths) {
            try {
                Files.deleteIfExists(p);
            } catch (IOException e) {
                LOG.warn("Failed to delete staged sample {}: {}", p, e.toString());
            }
        }
    }

    /**
     * Temp files of one scorer call, in sample order.
     */
    public static final class StagedSamples implements AutoCloseable {
        private final List<Path> paths;

        private StagedSamples(List<Path> paths) {
            this.paths = Collections.unmodifiableList(paths);
        }

        public Path first() {
            return paths.get(0);
        }

        public List<String> pathStrings() {
            return paths.stream().map(p -> p.toAbsolutePath().toString()).toList();
        }

        @Override
        public void close() {
            deleteAll(paths);
        }
    }
}
