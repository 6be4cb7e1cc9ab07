package com.volovo.tracksync.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class GeoUtilTest {

    private static final double SITE_LAT = 52.036242;
    private static final double SITE_LON = 37.887744;

    @Test
    @DisplayName("0.01° of longitude at the loading site is ≈ 0.683 km")
    void knownFixture() {
        double km = GeoUtil.distanceKm(SITE_LAT, SITE_LON, SITE_LAT, 37.897744);

        assertThat(km).isCloseTo(0.683, within(0.683 * 0.01));
    }

    @Test
    @DisplayName("Distance of a point to itself is zero")
    void samePointIsZero() {
        assertThat(GeoUtil.distanceKm(SITE_LAT, SITE_LON, SITE_LAT, SITE_LON)).isZero();
        assertThat(GeoUtil.distanceKm(-33.9, 151.2, -33.9, 151.2)).isZero();
    }

    @Test
    @DisplayName("Distance is symmetric")
    void symmetric() {
        double ab = GeoUtil.distanceKm(52.0, 37.0, 55.75, 37.62);
        double ba = GeoUtil.distanceKm(55.75, 37.62, 52.0, 37.0);

        assertThat(ab).isEqualTo(ba, within(1e-9));
        assertThat(ab).isBetween(400.0, 440.0);
    }

    @Test
    @DisplayName("Radius check includes the boundary and excludes points just outside")
    void withinRadius() {
        // ~11 m north of the center
        assertThat(GeoUtil.isWithinRadiusKm(SITE_LAT + 0.0001, SITE_LON, SITE_LAT, SITE_LON, 0.02)).isTrue();
        // ~33 m north
        assertThat(GeoUtil.isWithinRadiusKm(SITE_LAT + 0.0003, SITE_LON, SITE_LAT, SITE_LON, 0.02)).isFalse();
        assertThat(GeoUtil.isWithinRadiusKm(SITE_LAT, SITE_LON, SITE_LAT, SITE_LON, 0.0)).isTrue();
    }
}
