package com.phillippitts.compressorwatch.domain;

/**
 * Reserved {@code anomalyType} labels produced by the detectors themselves.
 *
 * <p>The scorer may return any other label (for example {@code bearing_wear}); those are
 * passed through unchanged.
 */
public final class AnomalyTypes {

    public static final String NORMAL = "normal";
    public static final String ERROR = "error";
    public static final String MODEL_NOT_INITIALIZED = "model_not_initialized";
    public static final String SYSTEM_NOT_INITIALIZED = "system_not_initialized";

    private AnomalyTypes() {}
}
