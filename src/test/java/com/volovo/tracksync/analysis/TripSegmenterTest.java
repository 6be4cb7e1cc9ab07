package com.volovo.tracksync.analysis;

import com.volovo.tracksync.model.Geofence;
import com.volovo.tracksync.model.TrackPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Entry-anchored segmentation: a trip spans one loading-site entry up to the next.
 */
class TripSegmenterTest {

    private static final Geofence SITE = new Geofence(52.036242, 37.887744, 0.02);
    private static final LocalDateTime T0 = LocalDateTime.of(2026, 2, 1, 0, 0);

    private static TrackPoint at(int i, boolean inside) {
        return TrackPoint.builder()
                .deviceId(182)
                .timestamp(T0.plusMinutes(i))
                .latitude(inside ? SITE.centerLatitude() : SITE.centerLatitude() + 0.01 + i * 0.001)
                .longitude(SITE.centerLongitude())
                .build();
    }

    private static List<TrackPoint> series(int length, Set<Integer> inside) {
        List<TrackPoint> points = new ArrayList<>();
        for (int i = 0; i < length; i++) {
            points.add(at(i, inside.contains(i)));
        }
        return points;
    }

    // ════════════════════════════════════════════════════════════════════════
    // Entries [0, 5, 12] in a series of 20
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Entries [0, 5, 12] over 20 points give trips [0:5], [5:12], [12:20]")
    void threeTrips() {
        List<TrackPoint> points = series(20, Set.of(0, 5, 12));

        TripSegmenter.Segmentation result = TripSegmenter.splitTrips(points, SITE);

        assertThat(result.entryIndices()).containsExactly(0, 5, 12);
        assertThat(result.trips()).extracting(Trip::startIndex).containsExactly(0, 5, 12);
        assertThat(result.trips()).extracting(Trip::endIndex).containsExactly(5, 12, 20);
        assertThat(result.trips()).extracting(Trip::size).containsExactly(5, 7, 8);
        assertThat(result.leadingPointCount()).isZero();
    }

    @Test
    @DisplayName("Cutting at given entry indices partitions the series without gaps")
    void splitAtIndices() {
        List<TrackPoint> points = series(20, Set.of());

        List<Trip> trips = TripSegmenter.split(points, List.of(0, 5, 12));

        assertThat(trips).hasSize(3);
        assertThat(trips.get(0).points()).isEqualTo(points.subList(0, 5));
        assertThat(trips.get(1).points()).isEqualTo(points.subList(5, 12));
        assertThat(trips.get(2).points()).isEqualTo(points.subList(12, 20));
    }

    @Test
    @DisplayName("Staying inside for several points is a single entry")
    void dwellIsOneEntry() {
        List<TrackPoint> points = series(10, Set.of(2, 3, 4, 7));

        assertThat(TripSegmenter.entryIndices(points, SITE)).containsExactly(2, 7);
    }

    @Test
    @DisplayName("Points before the first entry form no trip and are counted as leading")
    void leadingPoints() {
        List<TrackPoint> points = series(10, Set.of(3));

        TripSegmenter.Segmentation result = TripSegmenter.splitTrips(points, SITE);

        assertThat(result.leadingPointCount()).isEqualTo(3);
        assertThat(result.trips()).singleElement()
                .satisfies(trip -> {
                    assertThat(trip.startIndex()).isEqualTo(3);
                    assertThat(trip.endIndex()).isEqualTo(10);
                });
    }

    @Test
    @DisplayName("Without any entry the whole series is one trip")
    void noEntry() {
        List<TrackPoint> points = series(6, Set.of());

        TripSegmenter.Segmentation result = TripSegmenter.splitTrips(points, SITE);

        assertThat(result.entryIndices()).isEmpty();
        assertThat(result.trips()).singleElement().extracting(Trip::size).isEqualTo(6);
        assertThat(TripSegmenter.splitTrips(List.of(), SITE).trips()).isEmpty();
    }
}
