package com.phillippitts.compressorwatch.domain;

import com.phillippitts.compressorwatch.exception.ValidationException;

/**
 * Audio payload submitted for scoring. Owned by the caller; detectors only read it for the
 * duration of one call and never retain it.
 *
 * @param audio      raw audio bytes as captured by the sensor (must not be empty)
 * @param sampleRate sample rate in Hz (must be positive)
 */
public record DetectionSample(byte[] audio, int sampleRate) {

    /** Sample rate assumed when the caller does not provide one. */
    public static final int DEFAULT_SAMPLE_RATE = 16_000;

    /**
     * @throws ValidationException if audio is null/empty or sampleRate is not positive
     */
    public DetectionSample {
        if (audio == null || audio.length == 0) {
            throw new ValidationException("audio", "must not be null or empty");
        }
        if (sampleRate <= 0) {
            throw new ValidationException("sampleRate", "must be positive, got " + sampleRate);
        }
    }

    public static DetectionSample of(byte[] audio) {
        return new DetectionSample(audio, DEFAULT_SAMPLE_RATE);
    }

    public int sizeBytes() {
        return audio.length;
    }
}
