package com.volovo.tracksync.analysis;

import com.volovo.tracksync.model.TrackPoint;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Contiguous slice {@code [startIndex, endIndex)} of a device's filtered series.
 */
public record Trip(int startIndex, int endIndex, List<TrackPoint> points) {

    public Trip {
        points = List.copyOf(points);
    }

    public int size() {
        return points.size();
    }

    public double distanceKm() {
        return TrackDistance.totalKm(points);
    }

    public LocalDateTime startTime() {
        return points.isEmpty() ? null : points.get(0).getTimestamp();
    }

    public LocalDateTime endTime() {
        return points.isEmpty() ? null : points.get(points.size() - 1).getTimestamp();
    }
}
