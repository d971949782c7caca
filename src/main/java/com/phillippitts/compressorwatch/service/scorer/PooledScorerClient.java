package com.phillippitts.compressorwatch.service.scorer;

import com.phillippitts.compressorwatch.exception.ScorerException;
import com.phillippitts.compressorwatch.exception.ScorerExceptionBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ScorerClient} backed by a bounded pool of persistent scorer workers.
 *
 * <p>Workers are started lazily with the stage command plus {@code --serve} and exchange one JSON
 * line per request. A semaphore caps concurrent calls at the pool size; callers wait at most
 * {@code acquireTimeout} for a slot. A worker goes back to the pool only after an exchange that
 * produced parseable output, including {@code success=false} replies. Any other failure retires it
 * and a replacement is started on demand.
 */
public final class PooledScorerClient implements ScorerClient {

    private static final Logger LOG = LogManager.getLogger(PooledScorerClient.class);

    private final String detectorName;
    private final List<String> workerCommand;
    private final ScorerTimeouts timeouts;
    private final ProcessFactory processFactory;
    private final int maxResponseChars;
    private final Duration acquireTimeout;
    private final Semaphore slots;
    private final int poolSize;
    private final ConcurrentLinkedDeque<ScorerWorker> idle = new ConcurrentLinkedDeque<>();
    private final AtomicInteger workerIds = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public PooledScorerClient(String detectorName, List<String> commandLine, ScorerTimeouts timeouts,
                              int poolSize, Duration acquireTimeout, int maxResponseChars) {
        this(detectorName, commandLine, timeouts, poolSize, acquireTimeout, maxResponseChars,
                new DefaultProcessFactory());
    }

    PooledScorerClient(String detectorName, List<String> commandLine, ScorerTimeouts timeouts,
                       int poolSize, Duration acquireTimeout, int maxResponseChars,
                       ProcessFactory processFactory) {
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be positive: " + poolSize);
        }
        if (commandLine == null || commandLine.isEmpty()) {
            throw new IllegalArgumentException("commandLine must not be empty");
        }
        this.detectorName = Objects.requireNonNull(detectorName, "detectorName");
        List<String> cmd = new ArrayList<>(commandLine);
        cmd.add(ScorerConstants.SERVE_FLAG);
        this.workerCommand = List.copyOf(cmd);
        this.timeouts = Objects.requireNonNull(timeouts, "timeouts");
        this.poolSize = poolSize;
        this.acquireTimeout = Objects.requireNonNull(acquireTimeout, "acquireTimeout");
        this.maxResponseChars = maxResponseChars;
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.slots = new Semaphore(poolSize, true);
    }

    @Override
    public ScorerResponse call(ScorerRequest request) {
        Objects.requireNonNull(request, "request");
        ensureOpen();
        acquireSlot(request.command());
        try {
            ScorerWorker worker = borrowWorker(request.command());
            boolean reusable = false;
            try {
                String line = worker.exchange(request.toJson(), request.command(),
                        timeouts.forCommand(request.command()));
                ScorerResponse response = ScorerJsonParser.parse(line, detectorName, request.command());
                reusable = true;
                return response.requireSuccess(detectorName, request.command());
            } finally {
                if (reusable && !closed.get() && worker.isAlive()) {
                    idle.offerFirst(worker);
                } else {
                    worker.close();
                }
            }
        } finally {
            slots.release();
        }
    }

    private void acquireSlot(ScorerCommand command) {
        try {
            if (!slots.tryAcquire(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw ScorerExceptionBuilder.create("Scorer pool exhausted")
                        .detector(detectorName)
                        .command(command.wireName())
                        .metadata("poolSize", poolSize)
                        .metadata("waitedMs", acquireTimeout.toMillis())
                        .build();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScorerException("Interrupted while waiting for scorer worker", detectorName, e);
        }
    }

    private ScorerWorker borrowWorker(ScorerCommand command) {
        ScorerWorker worker;
        while ((worker = idle.pollFirst()) != null) {
            if (worker.isAlive()) {
                return worker;
            }
            LOG.warn("Discarding dead scorer worker for detector={}", detectorName);
            worker.close();
        }
        try {
            return new ScorerWorker(detectorName, workerCommand, processFactory, maxResponseChars,
                    workerIds.incrementAndGet());
        } catch (IOException e) {
            throw ScorerExceptionBuilder.create("Failed to start scorer worker: " + e.getMessage())
                    .detector(detectorName)
                    .command(command.wireName())
                    .metadata("executable", workerCommand.get(0))
                    .cause(e)
                    .build();
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new ScorerException("Scorer client is closed", detectorName);
        }
    }

    /**
     * @return number of idle workers currently pooled
     */
    int idleWorkers() {
        return idle.size();
    }

    @Override
    public String detectorName() {
        return detectorName;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        ScorerWorker worker;
        int count = 0;
        while ((worker = idle.pollFirst()) != null) {
            worker.close();
            count++;
        }
        LOG.info("Closed scorer pool for detector={} ({} idle workers stopped)", detectorName, count);
    }
}
