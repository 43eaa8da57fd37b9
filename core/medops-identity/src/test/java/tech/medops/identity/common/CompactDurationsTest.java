package tech.medops.identity.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class CompactDurationsTest {

    @ParameterizedTest
    @CsvSource({"30s,30", "15m,900", "12h,43200", "7d,604800", "' 10m ',600"})
    @DisplayName("toSeconds should convert each unit")
    void toSeconds_shouldConvertUnits(String value, long expected) {
        assertThat(CompactDurations.isValid(value)).isTrue();
        assertThat(CompactDurations.toSeconds(value, -1)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "m", "15", "15min", "-5m", "1.5h", "15 m", "99999999999999999999d",
        "999999999999999999d", "9223372036854775807m", "400000000d"})
    @DisplayName("toSeconds should return the fallback for malformed values")
    void toSeconds_shouldReturnFallback_whenMalformed(String value) {
        assertThat(CompactDurations.toSeconds(value, 42)).isEqualTo(42);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "m", "15", "15min", "-5m", "1.5h", "999999999999999999d", "9223372036854775807h"})
    @DisplayName("isValid should reject malformed or out-of-range values")
    void isValid_shouldRejectMalformed(String value) {
        assertThat(CompactDurations.isValid(value)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"3650000d", "87600000h"})
    @DisplayName("toSeconds should accept values at the upper bound")
    void toSeconds_shouldAcceptUpperBound(String value) {
        assertThat(CompactDurations.isValid(value)).isTrue();
        assertThat(CompactDurations.toSeconds(value, -1)).isEqualTo(CompactDurations.MAX_SECONDS);
    }
}
