package com.phillippitts.compressorwatch.service.scorer;

import com.phillippitts.compressorwatch.exception.ScorerException;
import com.phillippitts.compressorwatch.exception.ScorerExceptionBuilder;
import com.phillippitts.compressorwatch.util.ProcessTimeouts;
import com.phillippitts.compressorwatch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs one scorer process per call.
 *
 * <p>Responsibilities:
 * - Start the process via {@link ProcessFactory}
 * - Write the request document to stdin and close it
 * - Capture stdout (result) and stderr (diagnostics) concurrently
 * - Enforce a timeout and terminate runaway processes
 * - Provide structured error context in {@link ScorerException}
 *
 * <p>All per-call state is local, so one instance serves concurrent callers.
 */
final class ScorerProcessManager {

    private static final Logger LOG = LogManager.getLogger(ScorerProcessManager.class);

    private final ProcessFactory processFactory;
    private final int maxStdoutBytes;

    private record ProcessExecution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            StringBuffer stdout,
            StringBuffer stderr
    ) {}

    private record ErrorContext(
            String detectorName,
            ScorerCommand command,
            List<String> commandLine,
            int exitCode,
            StringBuffer stderr,
            long startNano,
            Throwable cause
    ) {}

    ScorerProcessManager(ProcessFactory processFactory, int maxStdoutBytes) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.maxStdoutBytes = maxStdoutBytes;
    }

    /**
     * Executes the scorer and returns its stdout.
     *
     * @param detectorName detector on whose behalf the call runs (error context only)
     * @param command scorer command being executed (error context only)
     * @param commandLine full command line
     * @param stdinPayload request document written to stdin
     * @param timeout hard deadline for the process
     * @return stdout content (may be empty)
     * @throws ScorerException on timeout, non-zero exit, or I/O error
     */
    String execute(String detectorName, ScorerCommand command, List<String> commandLine,
                   String stdinPayload, Duration timeout) {
        Objects.requireNonNull(commandLine, "commandLine");
        Objects.requireNonNull(timeout, "timeout");
        long startTime = System.nanoTime();
        ProcessExecution exec = null;

        try {
            exec = startProcessWithGobblers(commandLine, detectorName);
            writeRequest(exec.process(), stdinPayload);
            waitForProcessCompletion(exec, detectorName, command, commandLine, timeout, startTime);
            return handleProcessResult(exec, detectorName, command, commandLine, startTime);
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            StringBuffer stderr = exec == null ? null : exec.stderr();
            ErrorContext ctx = new ErrorContext(detectorName, command, commandLine, -1, stderr, startTime, e);
            throw scorerError("I/O failure: " + e.getMessage(), ctx);
        } finally {
            cleanup(exec);
        }
    }

    private ProcessExecution startProcessWithGobblers(List<String> commandLine, String detectorName)
            throws IOException {
        StringBuffer stdout = new StringBuffer();
        StringBuffer stderr = new StringBuffer();

        Process process = processFactory.start(commandLine, null);

        // Start gobblers before writing or waiting to avoid pipe deadlock
        Thread outGobbler = StreamGobbler.start(process.getInputStream(), stdout,
                "scorer-" + detectorName + "-out", maxStdoutBytes);
        Thread errGobbler = StreamGobbler.start(process.getErrorStream(), stderr,
                "scorer-" + detectorName + "-err", ScorerConstants.STDERR_MAX_BYTES);

        return new ProcessExecution(process, outGobbler, errGobbler, stdout, stderr);
    }

    private void writeRequest(Process process, String payload) throws IOException {
        try (OutputStream stdin = process.getOutputStream()) {
            if (payload != null) {
                stdin.write(payload.getBytes(StandardCharsets.UTF_8));
                stdin.write('\n');
            }
        }
    }

    private void waitForProcessCompletion(ProcessExecution exec, String detectorName, ScorerCommand command,
                                          List<String> commandLine, Duration timeout, long startTime)
            throws InterruptedException {
        boolean finished = exec.process().waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            destroyProcess(exec.process());
            ErrorContext ctx = new ErrorContext(detectorName, command, commandLine, -1, exec.stderr(),
                    startTime, null);
            throw scorerError("Timeout after " + timeout.toMillis() + "ms", ctx);
        }

        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
    }

    private String handleProcessResult(ProcessExecution exec, String detectorName, ScorerCommand command,
                                       List<String> commandLine, long startTime) {
        int exitCode = exec.process().exitValue();
        if (exitCode != 0) {
            ErrorContext ctx = new ErrorContext(detectorName, command, commandLine, exitCode, exec.stderr(),
                    startTime, null);
            throw scorerError("Non-zero exit: " + exitCode, ctx);
        }

        String output = exec.stdout().toString();
        LOG.debug("Scorer {} {} stdout size={} bytes", detectorName, command.wireName(), output.length());
        return output;
    }

    private void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Scorer process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying scorer process");
        } catch (RuntimeException e) {
            LOG.warn("Error destroying scorer process: {}", e.toString());
        }
    }

    private void cleanup(ProcessExecution exec) {
        if (exec == null) {
            return;
        }
        if (exec.process().isAlive()) {
            destroyProcess(exec.process());
        }
        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
    }

    private ScorerException scorerError(String msg, ErrorContext ctx) {
        long durationMs = TimeUtils.nanosToMillis(System.nanoTime() - ctx.startNano());
        ScorerExceptionBuilder builder = ScorerExceptionBuilder.create(msg)
                .detector(ctx.detectorName())
                .command(ctx.command().wireName())
                .exitCode(ctx.exitCode())
                .durationMs(durationMs)
                .metadata("executable", ctx.commandLine().isEmpty() ? null : ctx.commandLine().get(0))
                .metadata("stderr", StreamGobbler.snippet(ctx.stderr(), ScorerConstants.ERROR_SNIPPET_MAX_CHARS));

        if (ctx.cause() != null) {
            builder.cause(ctx.cause());
        }
        return builder.build();
    }
}
