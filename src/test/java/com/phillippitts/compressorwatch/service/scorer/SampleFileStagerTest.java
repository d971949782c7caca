package com.phillippitts.compressorwatch.service.scorer;

import com.phillippitts.compressorwatch.domain.DetectionSample;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SampleFileStagerTest {

    @TempDir
    Path tmp;

    @Test
    void writesEachSampleAndDeletesOnClose() throws Exception {
        SampleFileStager stager = new SampleFileStager(tmp.resolve("work"));
        DetectionSample a = DetectionSample.of(new byte[]{1, 2, 3});
        DetectionSample b = new DetectionSample(new byte[]{4, 5}, 44_100);

        List<Path> written;
        try (SampleFileStager.StagedSamples staged = stager.stage(List.of(a, b))) {
            List<String> paths = staged.pathStrings();
            assertThat(paths).hasSize(2);
            written = paths.stream().map(Path::of).toList();
            assertThat(Files.readAllBytes(written.get(0))).containsExactly(1, 2, 3);
            assertThat(Files.readAllBytes(written.get(1))).containsExactly(4, 5);
            assertThat(staged.first()).isEqualTo(written.get(0));
            assertThat(written.get(0).getFileName().toString()).startsWith("sample-").endsWith(".wav");
        }

        assertThat(written).allSatisfy(p -> assertThat(p).doesNotExist());
    }
}
