package com.phillippitts.compressorwatch.service.scorer;

/**
 * Operations understood by the external scorer. The wire name goes into the {@code command}
 * field of every request.
 */
public enum ScorerCommand {
    TRAIN("train", false),
    INITIALIZE("initialize", false),
    DETECT("detect", true),
    UPDATE_PARAMS("update_params", false),
    FORCE_UPDATE("force_update", false),
    SAVE("save", false);

    private final String wireName;
    private final boolean detection;

    ScorerCommand(String wireName, boolean detection) {
        this.wireName = wireName;
        this.detection = detection;
    }

    public String wireName() {
        return wireName;
    }

    /** Detection commands use the short detect timeout; all others use the setup timeout. */
    public boolean isDetection() {
        return detection;
    }
}
