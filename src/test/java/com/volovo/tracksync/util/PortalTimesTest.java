package com.volovo.tracksync.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.*;

class PortalTimesTest {

    private static final LocalDateTime FEB_1_0630 = LocalDateTime.of(2026, 2, 1, 6, 30, 15);

    @Test
    @DisplayName("Portal format and a T separator both parse")
    void parsesPortalShapes() {
        assertThat(PortalTimes.parse("2026-02-01 06:30:15")).isEqualTo(FEB_1_0630);
        assertThat(PortalTimes.parse("2026-02-01T06:30:15")).isEqualTo(FEB_1_0630);
    }

    @Test
    @DisplayName("Fractional seconds and zone suffixes are stripped, not converted")
    void stripsFractionAndZone() {
        assertThat(PortalTimes.parse("2026-02-01T06:30:15.123Z")).isEqualTo(FEB_1_0630);
        assertThat(PortalTimes.parse("2026-02-01T06:30:15+03:00")).isEqualTo(FEB_1_0630);
        assertThat(PortalTimes.parse("2026-02-01 06:30:15.5")).isEqualTo(FEB_1_0630);
    }

    @Test
    @DisplayName("Seconds are optional")
    void secondsOptional() {
        assertThat(PortalTimes.parse("2026-02-01 06:30")).isEqualTo(LocalDateTime.of(2026, 2, 1, 6, 30));
    }

    @Test
    @DisplayName("Garbage is empty for tryParse and an IllegalArgumentException for parse")
    void rejectsGarbage() {
        assertThat(PortalTimes.tryParse("yesterday")).isEmpty();
        assertThat(PortalTimes.tryParse("  ")).isEmpty();
        assertThat(PortalTimes.tryParse(null)).isEmpty();
        assertThatThrownBy(() -> PortalTimes.parse("01.02.2026"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("01.02.2026");
    }

    @Test
    @DisplayName("Formatting drops sub-second precision")
    void formatsToSeconds() {
        assertThat(PortalTimes.format(FEB_1_0630.withNano(999_000_000))).isEqualTo("2026-02-01 06:30:15");
    }
}
