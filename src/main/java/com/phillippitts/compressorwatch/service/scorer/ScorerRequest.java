package com.phillippitts.compressorwatch.service.scorer;

import org.json.JSONObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One request document for the scorer.
 *
 * <p>Serialized as a single-line JSON object: {@code {"command": "detect", "modelPath": ..., ...}}.
 * Field values may be strings, numbers, booleans, lists or maps.
 */
public final class ScorerRequest {

    private final ScorerCommand command;
    private final Map<String, Object> fields;

    private ScorerRequest(ScorerCommand command, Map<String, Object> fields) {
        this.command = command;
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static Builder builder(ScorerCommand command) {
        return new Builder(command);
    }

    public ScorerCommand command() {
        return command;
    }

    public Map<String, Object> fields() {
        return fields;
    }

    /**
     * @return compact JSON without line breaks, suitable for line-delimited exchange
     */
    public String toJson() {
        JSONObject json = new JSONObject();
        json.put("command", command.wireName());
        for (Map.Entry<String, Object> field : fields.entrySet()) {
            json.put(field.getKey(), JSONObject.wrap(field.getValue()));
        }
        return json.toString();
    }

    @Override
    public String toString() {
        return "ScorerRequest{command=" + command.wireName() + ", fields=" + fields.keySet() + '}';
    }

    public static final class Builder {
        private final ScorerCommand command;
        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder(ScorerCommand command) {
            this.command = Objects.requireNonNull(command, "command");
        }

        /** Adds a field; null values are skipped. */
        public Builder field(String name, Object value) {
            if (name != null && value != null) {
                fields.put(name, value);
            }
            return this;
        }

        public ScorerRequest build() {
            return new ScorerRequest(command, new LinkedHashMap<>(fields));
        }
    }
}
