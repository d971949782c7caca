package com.phillippitts.compressorwatch.service.scorer;

/**
 * Field names of scorer request documents.
 */
public final class ScorerFields {

    public static final String MODEL_PATH = "modelPath";
    public static final String AUDIO_PATH = "audioPath";
    public static final String SAMPLE_RATE = "sampleRate";
    public static final String GROUND_TRUTH = "groundTruth";
    public static final String PARAMS = "params";
    public static final String FILES = "files";
    public static final String SAMPLE_RATES = "sampleRates";
    public static final String BASELINE_MODEL_PATH = "baselineModelPath";
    public static final String ADAPTIVE_MODEL_PATH = "adaptiveModelPath";

    private ScorerFields() {
        // Constants class - prevent instantiation
    }
}
