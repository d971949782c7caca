package com.phillippitts.compressorwatch.service.scorer;

import com.phillippitts.compressorwatch.domain.AnomalyTypes;
import com.phillippitts.compressorwatch.exception.ScorerExceptionBuilder;
import com.phillippitts.compressorwatch.util.LogSanitizer;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Parses scorer stdout into a {@link ScorerResponse}.
 *
 * <p>Scorer scripts sometimes print progress lines before the result, so when the whole output
 * is not a JSON object the last line that looks like one is tried instead. Numeric fields are
 * clamped into [0, 1]; non-finite values become 0.
 */
final class ScorerJsonParser {

    private static final int OUTPUT_SNIPPET_MAX_CHARS = 200;

    private ScorerJsonParser() {}

    /**
     * @param output raw stdout of the scorer (one-shot) or one response line (pooled)
     * @param detectorName detector name for error context
     * @param command command the output answers
     * @return parsed response (not yet checked for {@code success})
     * @throws com.phillippitts.compressorwatch.exception.ScorerOutputException if no JSON object can be read
     */
    static ScorerResponse parse(String output, String detectorName, ScorerCommand command) {
        JSONObject json = readObject(output);
        if (json == null) {
            throw ScorerExceptionBuilder.create("Malformed scorer output")
                    .detector(detectorName)
                    .command(command.wireName())
                    .metadata("output", LogSanitizer.truncate(output, OUTPUT_SNIPPET_MAX_CHARS))
                    .outputFailure()
                    .build();
        }
        return toResponse(json);
    }

    private static JSONObject readObject(String output) {
        if (output == null || output.isBlank()) {
            return null;
        }
        String trimmed = output.trim();
        try {
            return new JSONObject(trimmed);
        } catch (JSONException whole) {
            String[] lines = trimmed.split("\\R");
            for (int i = lines.length - 1; i >= 0; i--) {
                String line = lines[i].trim();
                if (line.startsWith("{")) {
                    try {
                        return new JSONObject(line);
                    } catch (JSONException ignored) {
                        // try earlier lines
                    }
                }
            }
            return null;
        }
    }

    private static ScorerResponse toResponse(JSONObject json) {
        boolean success = json.optBoolean("success", false);
        boolean anomalous = json.optBoolean("isAnomaly", false);
        double confidence = unit(json.optDouble("confidence", 0.0));
        double anomalyScore = unit(json.optDouble("anomalyScore", 0.0));
        String defaultType = anomalous ? "anomaly" : AnomalyTypes.NORMAL;
        String anomalyType = json.optString("anomalyType", defaultType);
        if (anomalyType == null || anomalyType.isBlank()) {
            anomalyType = defaultType;
        }

        Double reliability = json.has("reliability") ? unit(json.optDouble("reliability", 0.0)) : null;
        Double consensusRate = null;
        JSONObject consensusInfo = json.optJSONObject("consensusInfo");
        if (consensusInfo != null && consensusInfo.has("consensusRate")) {
            consensusRate = unit(consensusInfo.optDouble("consensusRate", 0.0));
        }
        String message = json.has("message") ? json.optString("message", null) : null;

        return new ScorerResponse(success, anomalous, confidence, anomalyScore, anomalyType,
                reliability, consensusRate, message);
    }

    private static double unit(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
