package com.volovo.tracksync.model;

import com.volovo.tracksync.util.GeoUtil;

/**
 * Circular zone around the loading site.
 */
public record Geofence(double centerLatitude, double centerLongitude, double radiusKm) {

    public Geofence {
        if (radiusKm < 0) {
            throw new IllegalArgumentException("Geofence radius must not be negative: " + radiusKm);
        }
    }

    public boolean contains(double latitude, double longitude) {
        return GeoUtil.isWithinRadiusKm(latitude, longitude, centerLatitude, centerLongitude, radiusKm);
    }

    public boolean contains(TrackPoint point) {
        return contains(point.getLatitude(), point.getLongitude());
    }
}
