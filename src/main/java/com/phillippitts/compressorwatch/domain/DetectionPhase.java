package com.phillippitts.compressorwatch.domain;

/**
 * The three detector stages. The numeric value is what the REST surface and monitoring
 * records report as {@code phase}.
 */
public enum DetectionPhase {
    BASELINE(1, "baseline"),
    ADAPTIVE(2, "adaptive"),
    CONSENSUS(3, "consensus");

    private final int number;
    private final String detectorName;

    DetectionPhase(int number, String detectorName) {
        this.number = number;
        this.detectorName = detectorName;
    }

    public int number() {
        return number;
    }

    public String detectorName() {
        return detectorName;
    }
}
