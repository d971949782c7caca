package com.phillippitts.compressorwatch.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ScorerException} carrying process diagnostics.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw ScorerExceptionBuilder.create("Non-zero exit: 2")
 *         .detector("baseline")
 *         .command("detect")
 *         .exitCode(2)
 *         .durationMs(1500)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 *
 * <p>Message format: {@code {message} (command=..., exitCode=..., durationMs=..., key=value, ...)}.
 */
public final class ScorerExceptionBuilder {

    private final String message;
    private String detectorName;
    private String command;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private boolean outputFailure;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ScorerExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static ScorerExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ScorerExceptionBuilder(message);
    }

    public ScorerExceptionBuilder detector(String detectorName) {
        this.detectorName = detectorName;
        return this;
    }

    public ScorerExceptionBuilder command(String command) {
        this.command = command;
        return this;
    }

    public ScorerExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ScorerExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public ScorerExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Marks the failure as unparseable output, producing a {@link ScorerOutputException}.
     *
     * @return this builder for chaining
     */
    public ScorerExceptionBuilder outputFailure() {
        this.outputFailure = true;
        return this;
    }

    /**
     * Adds a metadata key-value pair; null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public ScorerExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public ScorerException build() {
        String detailedMessage = buildDetailedMessage();
        String detector = detectorName != null ? detectorName : "unknown";

        if (outputFailure) {
            return cause != null
                    ? new ScorerOutputException(detailedMessage, detector, cause)
                    : new ScorerOutputException(detailedMessage, detector);
        }
        if (cause != null) {
            return new ScorerException(detailedMessage, detector, cause);
        }
        return new ScorerException(detailedMessage, detector);
    }

    private String buildDetailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (command != null) {
            details.put("command", command);
        }
        if (exitCode != null) {
            details.put("exitCode", String.valueOf(exitCode));
        }
        if (durationMs != null) {
            details.put("durationMs", String.valueOf(durationMs));
        }
        details.putAll(metadata);

        if (details.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
