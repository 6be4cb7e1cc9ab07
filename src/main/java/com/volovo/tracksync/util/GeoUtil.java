package com.volovo.tracksync.util;

/**
 * Great-circle geometry on a spherical Earth.
 */
public final class GeoUtil {

    // Mean Earth radius in kilometers
    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeoUtil() {
    }

    /**
     * Calculate distance between two GPS coordinates using Haversine formula
     *
     * @param lat1 Latitude of first point
     * @param lon1 Longitude of first point
     * @param lat2 Latitude of second point
     * @param lon2 Longitude of second point
     * @return Distance in kilometers
     */
    public static double distanceKm(double lat1, double lon1, double lat2, double lon2) {
        double lat1Rad = Math.toRadians(lat1);
        double lat2Rad = Math.toRadians(lat2);

        double deltaLat = Math.toRadians(lat2 - lat1);
        double deltaLon = Math.toRadians(lon2 - lon1);

        double a = Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2) +
                   Math.cos(lat1Rad) * Math.cos(lat2Rad) *
                   Math.sin(deltaLon / 2) * Math.sin(deltaLon / 2);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_KM * c;
    }

    /**
     * Check if a point is within a circular zone
     *
     * @param lat       Latitude of point to check
     * @param lon       Longitude of point to check
     * @param centerLat Latitude of zone center
     * @param centerLon Longitude of zone center
     * @param radiusKm  Radius of the zone in kilometers
     * @return true if the point lies on or inside the circle
     */
    public static boolean isWithinRadiusKm(double lat, double lon, double centerLat, double centerLon, double radiusKm) {
        return distanceKm(centerLat, centerLon, lat, lon) <= radiusKm;
    }
}
