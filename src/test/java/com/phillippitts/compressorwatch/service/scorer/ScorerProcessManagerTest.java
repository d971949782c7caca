package com.phillippitts.compressorwatch.service.scorer;

import com.phillippitts.compressorwatch.exception.ScorerException;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static com.phillippitts.compressorwatch.service.scorer.ScorerTestDoubles.ProcessBehavior;
import static com.phillippitts.compressorwatch.service.scorer.ScorerTestDoubles.StubProcessFactory;
import static com.phillippitts.compressorwatch.service.scorer.ScorerTestDoubles.TestProcess;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScorerProcessManagerTest {

    private static final List<String> CMD = List.of("python3", "ai/phase1_basic_anomaly.py");

    @Test
    void successReturnsStdoutAndWritesRequestToStdin() {
        // Arrange
        TestProcess tp = new TestProcess(new ProcessBehavior("{\"success\":true}", "", 0, 0));
        ScorerProcessManager mgr = new ScorerProcessManager(new StubProcessFactory(tp), 1_048_576);

        // Act
        String out = mgr.execute("baseline", ScorerCommand.DETECT, CMD, "{\"command\":\"detect\"}",
                Duration.ofSeconds(2));

        // Assert
        assertThat(out).contains("\"success\":true");
        assertThat(tp.stdinText()).isEqualTo("{\"command\":\"detect\"}\n");
    }

    @Test
    void nonZeroExitThrowsWithStderrSnippet() {
        TestProcess tp = new TestProcess(new ProcessBehavior("", "model file missing", 2, 0));
        ScorerProcessManager mgr = new ScorerProcessManager(new StubProcessFactory(tp), 1_048_576);

        assertThatThrownBy(() -> mgr.execute("baseline", ScorerCommand.TRAIN, CMD, "{}", Duration.ofSeconds(2)))
                .isInstanceOf(ScorerException.class)
                .hasMessageContaining("Non-zero exit: 2")
                .hasMessageContaining("command=train")
                .hasMessageContaining("executable=python3")
                .hasMessageContaining("stderr=model file missing")
                .hasMessageContaining("detector: baseline");
    }

    @Test
    void timeoutKillsProcessAndThrows() {
        TestProcess tp = new TestProcess(new ProcessBehavior("", "", 0, -1 /*never finish*/));
        ScorerProcessManager mgr = new ScorerProcessManager(new StubProcessFactory(tp), 1_048_576);

        long start = System.nanoTime();
        assertThatThrownBy(() -> mgr.execute("adaptive", ScorerCommand.DETECT, CMD, "{}", Duration.ofMillis(200)))
                .isInstanceOf(ScorerException.class)
                .hasMessageContaining("Timeout after 200ms");
        long durationMs = (System.nanoTime() - start) / 1_000_000L;
        assertThat(durationMs).isLessThan(5000);

        Awaitility.await().atMost(2, TimeUnit.SECONDS).until(tp::wasDestroyCalled);
    }

    @Test
    void startFailureIsReportedAsIoFailure() {
        ProcessFactory failing = (command, dir) -> {
            throw new IOException("No such file or directory");
        };
        ScorerProcessManager mgr = new ScorerProcessManager(failing, 1_048_576);

        assertThatThrownBy(() -> mgr.execute("consensus", ScorerCommand.INITIALIZE, CMD, "{}", Duration.ofSeconds(1)))
                .isInstanceOf(ScorerException.class)
                .hasMessageContaining("I/O failure: No such file or directory")
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void stdoutIsCappedAtConfiguredSize() {
        String big = "x".repeat(5000);
        TestProcess tp = new TestProcess(new ProcessBehavior(big, "", 0, 0));
        ScorerProcessManager mgr = new ScorerProcessManager(new StubProcessFactory(tp), 1000);

        String out = mgr.execute("baseline", ScorerCommand.DETECT, CMD, "{}", Duration.ofSeconds(2));

        assertThat(out).hasSize(1000);
    }
}
