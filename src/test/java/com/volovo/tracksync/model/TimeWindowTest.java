package com.volovo.tracksync.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TimeWindowTest {

    private static final LocalDateTime FEB_1 = LocalDateTime.of(2026, 2, 1, 0, 0);

    @Test
    @DisplayName("A 6h range with 6h chunks is exactly one window")
    void singleWindow() {
        List<TimeWindow> windows = TimeWindow.chunk(FEB_1, FEB_1.plusHours(6), 6);

        assertThat(windows).containsExactly(new TimeWindow(FEB_1, FEB_1.plusHours(6)));
    }

    @Test
    @DisplayName("Windows are consecutive and the last one is clipped")
    void clipsLastWindow() {
        List<TimeWindow> windows = TimeWindow.chunk(FEB_1, FEB_1.plusHours(14), 6);

        assertThat(windows).containsExactly(
                new TimeWindow(FEB_1, FEB_1.plusHours(6)),
                new TimeWindow(FEB_1.plusHours(6), FEB_1.plusHours(12)),
                new TimeWindow(FEB_1.plusHours(12), FEB_1.plusHours(14)));
    }

    @Test
    @DisplayName("Chunk length below one hour is raised to one hour")
    void minimumOneHour() {
        assertThat(TimeWindow.chunk(FEB_1, FEB_1.plusHours(3), 0)).hasSize(3);
    }

    @Test
    @DisplayName("Empty or reversed ranges give no windows")
    void emptyRange() {
        assertThat(TimeWindow.chunk(FEB_1, FEB_1, 6)).isEmpty();
        assertThat(TimeWindow.chunk(FEB_1, FEB_1.minusHours(1), 6)).isEmpty();
    }

    @Test
    @DisplayName("Window id is stable and readable")
    void id() {
        assertThat(new TimeWindow(FEB_1, FEB_1.plusHours(6)).id())
                .isEqualTo("2026-02-01 00:00:00|2026-02-01 06:00:00");
    }

    @Test
    @DisplayName("Filter thresholds outside their bounds are rejected")
    void filterConfigBounds() {
        assertThatThrownBy(() -> new FilterConfig(51.0, 180.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FilterConfig(1.0, 0.5)).isInstanceOf(IllegalArgumentException.class);
        assertThat(new FilterConfig(0.0, 400.0).maxJumpKm()).isZero();
    }
}
