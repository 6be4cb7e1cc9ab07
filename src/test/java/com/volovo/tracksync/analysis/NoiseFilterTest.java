package com.volovo.tracksync.analysis;

import com.volovo.tracksync.model.FilterConfig;
import com.volovo.tracksync.model.TrackPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class NoiseFilterTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2026, 2, 1, 8, 0);

    // 1 km of latitude ≈ 0.008993°
    private static final double KM_LAT = 1.0 / 111.195;

    private static TrackPoint point(int seconds, double northKm) {
        return TrackPoint.builder()
                .deviceId(182)
                .timestamp(T0.plusSeconds(seconds))
                .latitude(52.0 + northKm * KM_LAT)
                .longitude(37.9)
                .build();
    }

    @Test
    @DisplayName("A 2 km jump is rejected and the next point is compared with the last kept one")
    void jumpRejectedAndExcluded() {
        TrackPoint start = point(0, 0.0);
        TrackPoint jump = point(600, 2.0);
        TrackPoint next = point(1200, 0.2);   // 1.8 km from the jump, 0.2 km from start

        NoiseFilter.Result result = NoiseFilter.filterJumps(List.of(start, jump, next), FilterConfig.DEFAULTS);

        assertThat(result.kept()).containsExactly(start, next);
        assertThat(result.stats()).isEqualTo(new NoiseFilter.Stats(3, 2, 1));
    }

    @Test
    @DisplayName("A burst of outliers followed by one valid fix keeps exactly {first, valid}")
    void burstAbsorbed() {
        List<TrackPoint> points = new ArrayList<>();
        TrackPoint first = point(0, 0.0);
        points.add(first);
        for (int i = 1; i <= 5; i++) {
            points.add(point(i * 60, 5.0 + i * 0.1));  // outliers close to each other
        }
        TrackPoint valid = point(400, 0.3);
        points.add(valid);

        NoiseFilter.Result result = NoiseFilter.filterJumps(points, 1.0, 180.0);

        assertThat(result.kept()).containsExactly(first, valid);
        assertThat(result.stats().removed()).isEqualTo(5);
    }

    @Test
    @DisplayName("Implied speed above the limit is rejected even when the jump is short")
    void speedRejected() {
        TrackPoint start = point(0, 0.0);
        TrackPoint tooFast = point(10, 0.9);   // 0.9 km in 10 s = 324 km/h

        NoiseFilter.Result result = NoiseFilter.filterJumps(List.of(start, tooFast), FilterConfig.DEFAULTS);

        assertThat(result.kept()).containsExactly(start);
    }

    @Test
    @DisplayName("Speed is not checked between points with the same timestamp")
    void sameTimestampSkipsSpeedCheck() {
        TrackPoint start = point(0, 0.0);
        TrackPoint sameTick = point(0, 0.5);

        NoiseFilter.Result result = NoiseFilter.filterJumps(List.of(start, sameTick), FilterConfig.DEFAULTS);

        assertThat(result.kept()).containsExactly(start, sameTick);
    }

    @Test
    @DisplayName("Empty and single-point series pass through")
    void trivialSeries() {
        assertThat(NoiseFilter.filterJumps(List.of(), FilterConfig.DEFAULTS).kept()).isEmpty();
        TrackPoint only = point(0, 0.0);
        assertThat(NoiseFilter.filterJumps(List.of(only), FilterConfig.DEFAULTS).kept()).containsExactly(only);
    }
}
