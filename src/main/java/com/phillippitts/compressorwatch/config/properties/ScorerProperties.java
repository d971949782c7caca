package com.phillippitts.compressorwatch.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the external scoring collaborator.
 * Binds to properties prefixed with "scorer".
 *
 * <p>Example application.properties:
 * <pre>
 * scorer.mode=pooled
 * scorer.detect-timeout=30s
 * scorer.setup-timeout=10m
 * scorer.pool-size=2
 * scorer.baseline.command=python3,ai/phase1_basic_anomaly.py
 * scorer.baseline.model-path=data/models/phase1/
 * </pre>
 *
 * <p>Every scorer call is bounded: detection calls by {@code detect-timeout}, everything else
 * (train, initialize, parameter updates, forced re-fit, save) by {@code setup-timeout}.
 */
@ConfigurationProperties(prefix = "scorer")
@Validated
public class ScorerProperties {

    public enum Mode { POOLED, PER_CALL }

    @NotNull
    private Mode mode = Mode.POOLED;

    @NotNull
    private Duration detectTimeout = Duration.ofSeconds(30);

    @NotNull
    private Duration setupTimeout = Duration.ofMinutes(10);

    /** Persistent workers per stage in pooled mode. */
    @Positive(message = "Pool size must be positive")
    private int poolSize = 2;

    /** Maximum wait for a free worker (pooled) before the call fails. */
    @NotNull
    private Duration acquireTimeout = Duration.ofSeconds(5);

    @Positive(message = "Max stdout bytes must be positive")
    private int maxStdoutBytes = 1_048_576;

    /** Directory for temporary audio files; system temp directory when blank. */
    private String workDir;

    @Valid
    private StageProperties baseline = new StageProperties(
            List.of("python3", "ai/phase1_basic_anomaly.py"), "data/models/phase1/");

    @Valid
    private StageProperties adaptive = new StageProperties(
            List.of("python3", "ai/phase2_adaptive_system.py"), "data/models/phase2/");

    @Valid
    private StageProperties consensus = new StageProperties(
            List.of("python3", "ai/phase3_integrated_system.py"), "data/models/phase3/");

    public Mode getMode() {
        return mode;
    }

    public void setMode(Mode mode) {
        this.mode = mode;
    }

    public Duration getDetectTimeout() {
        return detectTimeout;
    }

    public void setDetectTimeout(Duration detectTimeout) {
        this.detectTimeout = detectTimeout;
    }

    public Duration getSetupTimeout() {
        return setupTimeout;
    }

    public void setSetupTimeout(Duration setupTimeout) {
        this.setupTimeout = setupTimeout;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    public Duration getAcquireTimeout() {
        return acquireTimeout;
    }

    public void setAcquireTimeout(Duration acquireTimeout) {
        this.acquireTimeout = acquireTimeout;
    }

    public int getMaxStdoutBytes() {
        return maxStdoutBytes;
    }

    public void setMaxStdoutBytes(int maxStdoutBytes) {
        this.maxStdoutBytes = maxStdoutBytes;
    }

    public String getWorkDir() {
        return workDir;
    }

    public void setWorkDir(String workDir) {
        this.workDir = workDir;
    }

    public StageProperties getBaseline() {
        return baseline;
    }

    public void setBaseline(StageProperties baseline) {
        this.baseline = baseline;
    }

    public StageProperties getAdaptive() {
        return adaptive;
    }

    public void setAdaptive(StageProperties adaptive) {
        this.adaptive = adaptive;
    }

    public StageProperties getConsensus() {
        return consensus;
    }

    public void setConsensus(StageProperties consensus) {
        this.consensus = consensus;
    }

    /**
     * Scorer command line and model artifact location for one detector stage.
     */
    public static class StageProperties {

        @NotEmpty(message = "Scorer command must not be empty")
        private List<String> command = new ArrayList<>();

        @NotBlank(message = "Model path must not be blank")
        private String modelPath;

        public StageProperties() {
        }

        public StageProperties(List<String> command, String modelPath) {
            this.command = new ArrayList<>(command);
            this.modelPath = modelPath;
        }

        public List<String> getCommand() {
            return command;
        }

        public void setCommand(List<String> command) {
            this.command = command;
        }

        public String getModelPath() {
            return modelPath;
        }

        public void setModelPath(String modelPath) {
            this.modelPath = modelPath;
        }
    }
}
