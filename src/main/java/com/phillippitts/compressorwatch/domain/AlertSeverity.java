package com.phillippitts.compressorwatch.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AlertSeverity {
    WARNING,
    CRITICAL;

    /**
     * @return lowercase wire form ({@code warning} / {@code critical})
     */
    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
