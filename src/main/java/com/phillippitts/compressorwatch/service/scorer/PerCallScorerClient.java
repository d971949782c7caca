package com.phillippitts.compressorwatch.service.scorer;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * {@link ScorerClient} that starts a fresh scorer process for every request.
 *
 * <p>The request is written to the child's stdin and the decision record is read from its
 * stdout. Startup cost is paid on every call; prefer {@link PooledScorerClient} unless the scorer
 * cannot run as a worker.
 */
public final class PerCallScorerClient implements ScorerClient {

    private final String detectorName;
    private final List<String> commandLine;
    private final ScorerProcessManager processManager;
    private final ScorerTimeouts timeouts;

    public PerCallScorerClient(String detectorName, List<String> commandLine, ScorerTimeouts timeouts,
                               int maxStdoutBytes) {
        this(detectorName, commandLine, timeouts, new ScorerProcessManager(new DefaultProcessFactory(), maxStdoutBytes));
    }

    PerCallScorerClient(String detectorName, List<String> commandLine, ScorerTimeouts timeouts,
                        ScorerProcessManager processManager) {
        this.detectorName = Objects.requireNonNull(detectorName, "detectorName");
        this.commandLine = List.copyOf(commandLine);
        this.timeouts = Objects.requireNonNull(timeouts, "timeouts");
        this.processManager = Objects.requireNonNull(processManager, "processManager");
        if (this.commandLine.isEmpty()) {
            throw new IllegalArgumentException("commandLine must not be empty");
        }
    }

    @Override
    public ScorerResponse call(ScorerRequest request) {
        Objects.requireNonNull(request, "request");
        Duration timeout = timeouts.forCommand(request.command());
        String stdout = processManager.execute(detectorName, request.command(), commandLine,
                request.toJson(), timeout);
        return ScorerJsonParser.parse(stdout, detectorName, request.command())
                .requireSuccess(detectorName, request.command());
    }

    @Override
    public String detectorName() {
        return detectorName;
    }

    @Override
    public void close() {
        // Nothing long-lived to release
    }
}
