package com.volovo.tracksync.analysis;

import com.volovo.tracksync.model.TrackPoint;
import com.volovo.tracksync.util.GeoUtil;

import java.util.List;

public final class TrackDistance {

    private TrackDistance() {
    }

    /** Sum of great-circle legs between consecutive points, in km */
    public static double totalKm(List<TrackPoint> points) {
        double total = 0.0;
        for (int i = 1; i < points.size(); i++) {
            total += between(points.get(i - 1), points.get(i));
        }
        return total;
    }

    public static double between(TrackPoint a, TrackPoint b) {
        return GeoUtil.distanceKm(a.getLatitude(), a.getLongitude(), b.getLatitude(), b.getLongitude());
    }
}
