package com.phillippitts.compressorwatch.service.scorer;

import com.phillippitts.compressorwatch.exception.ScorerException;
import com.phillippitts.compressorwatch.exception.ScorerExceptionBuilder;
import com.phillippitts.compressorwatch.util.ProcessTimeouts;
import com.phillippitts.compressorwatch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One long-lived scorer process speaking line-delimited JSON.
 *
 * <p>Each {@link #exchange} writes one request line and reads stdout until a line starting with
 * {@code '{'} arrives; other lines are treated as progress output and skipped. A worker is used by
 * one caller at a time; {@link PooledScorerClient} guarantees that.
 *
 * <p>After any failed exchange the stream position is unknown, so the caller must {@link #close()}
 * the worker instead of reusing it.
 */
final class ScorerWorker implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(ScorerWorker.class);

    private final String detectorName;
    private final String executable;
    private final Process process;
    private final BufferedWriter stdin;
    private final BufferedReader stdout;
    private final StringBuffer stderr = new StringBuffer();
    private final Thread errGobbler;
    private final ExecutorService reader;
    private final int maxResponseChars;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    ScorerWorker(String detectorName, List<String> commandLine, ProcessFactory processFactory,
                 int maxResponseChars, int workerId) throws IOException {
        this.detectorName = detectorName;
        this.executable = commandLine.isEmpty() ? null : commandLine.get(0);
        this.maxResponseChars = maxResponseChars;
        this.process = processFactory.start(commandLine, null);
        this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        this.stdout = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
        String threadName = "scorer-" + detectorName + "-w" + workerId;
        this.errGobbler = StreamGobbler.start(process.getErrorStream(), stderr, threadName + "-err",
                ScorerConstants.STDERR_MAX_BYTES);
        this.reader = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, threadName + "-out");
            t.setDaemon(true);
            return t;
        });
        LOG.info("Started scorer worker {} for detector={}", threadName, detectorName);
    }

    boolean isAlive() {
        return !closed.get() && process.isAlive();
    }

    /**
     * Sends one request line and waits for the matching response line.
     *
     * @param requestLine single-line JSON request
     * @param command command being sent (error context)
     * @param timeout deadline for the whole exchange
     * @return the response line (a JSON object candidate)
     * @throws ScorerException on timeout, EOF, oversize output, or I/O failure
     */
    String exchange(String requestLine, ScorerCommand command, Duration timeout) {
        long startTime = System.nanoTime();
        try {
            stdin.write(requestLine);
            stdin.write('\n');
            stdin.flush();
        } catch (IOException e) {
            throw failure("Failed to write request: " + e.getMessage(), command, startTime, e);
        }

        Future<String> pending = reader.submit(this::readResponseLine);
        try {
            String line = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (line == null) {
                throw failure("Scorer worker closed its output", command, startTime, null);
            }
            return line;
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw failure("Timeout after " + timeout.toMillis() + "ms", command, startTime, null);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw failure("Interrupted while waiting for scorer", command, startTime, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ScorerException se) {
                throw se;
            }
            throw failure("I/O failure: " + cause.getMessage(), command, startTime, cause);
        }
    }

    private String readResponseLine() throws IOException {
        int skipped = 0;
        String line;
        while ((line = stdout.readLine()) != null) {
            String trimmed = line.trim();
            if (trimmed.startsWith("{")) {
                return trimmed;
            }
            skipped += line.length();
            if (skipped > maxResponseChars) {
                throw ScorerExceptionBuilder.create("Scorer output exceeded " + maxResponseChars
                                + " chars without a response")
                        .detector(detectorName)
                        .outputFailure()
                        .build();
            }
            LOG.debug("Scorer {} progress: {}", detectorName, trimmed);
        }
        return null;
    }

    private ScorerException failure(String msg, ScorerCommand command, long startTime, Throwable cause) {
        ScorerExceptionBuilder builder = ScorerExceptionBuilder.create(msg)
                .detector(detectorName)
                .command(command.wireName())
                .durationMs(TimeUtils.nanosToMillis(System.nanoTime() - startTime))
                .metadata("executable", executable)
                .metadata("stderr", StreamGobbler.snippet(stderr, ScorerConstants.ERROR_SNIPPET_MAX_CHARS));
        if (!process.isAlive()) {
            builder.exitCode(process.exitValue());
        }
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            stdin.close();
        } catch (IOException e) {
            LOG.debug("Closing worker stdin failed: {}", e.toString());
        }
        if (process.isAlive()) {
            ScorerProcessManager.destroyProcess(process);
        }
        reader.shutdownNow();
        try {
            errGobbler.join(ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.debug("Closed scorer worker for detector={}", detectorName);
    }
}
