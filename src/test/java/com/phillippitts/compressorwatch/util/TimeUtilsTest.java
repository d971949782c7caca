package com.phillippitts.compressorwatch.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void nanosToMillisTruncates() {
        assertThat(TimeUtils.nanosToMillis(1_999_999L)).isEqualTo(1L);
    }

    @Test
    void elapsedMillisIsNeverNegative() {
        assertThat(TimeUtils.elapsedMillis(System.nanoTime() + 5_000_000_000L)).isZero();
        assertThat(TimeUtils.elapsedMillis(System.nanoTime() - 2_000_000L)).isGreaterThanOrEqualTo(2L);
    }
}
