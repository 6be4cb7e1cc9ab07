package com.volovo.tracksync.analysis;

import com.volovo.tracksync.model.Geofence;
import com.volovo.tracksync.model.TrackPoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a series into trips at loading-site entries.
 *
 * An entry is a point inside the geofence whose predecessor was outside; the
 * series starts outside, so a first point inside is an entry too. A trip runs
 * from one entry up to, not including, the next entry, and the last one to the
 * end of the series. Points before the first entry belong to no trip and are
 * only counted. Without any entry the whole series is a single trip.
 *
 * Trips never overlap and never leave gaps after the first entry. Dropping
 * short trips is up to the caller.
 */
public final class TripSegmenter {

    private TripSegmenter() {
    }

    /**
     * @param leadingPointCount points before the first entry, not part of any trip
     */
    public record Segmentation(List<Trip> trips, List<Integer> entryIndices, int leadingPointCount) {
    }

    public static Segmentation splitTrips(List<TrackPoint> points, Geofence geofence) {
        List<Integer> entries = entryIndices(points, geofence);
        return new Segmentation(split(points, entries), entries, entries.isEmpty() ? 0 : entries.get(0));
    }

    public static List<Integer> entryIndices(List<TrackPoint> points, Geofence geofence) {
        List<Integer> entries = new ArrayList<>();
        boolean inside = false;
        for (int i = 0; i < points.size(); i++) {
            boolean nowInside = geofence.contains(points.get(i));
            if (nowInside && !inside) {
                entries.add(i);
            }
            inside = nowInside;
        }
        return entries;
    }

    /**
     * Cuts {@code points} at the given ascending entry indices.
     */
    public static List<Trip> split(List<TrackPoint> points, List<Integer> entryIndices) {
        List<Trip> trips = new ArrayList<>();
        if (points.isEmpty()) {
            return trips;
        }
        if (entryIndices.isEmpty()) {
            trips.add(new Trip(0, points.size(), points));
            return trips;
        }
        for (int i = 0; i < entryIndices.size(); i++) {
            int start = entryIndices.get(i);
            int end = i + 1 < entryIndices.size() ? entryIndices.get(i + 1) : points.size();
            trips.add(new Trip(start, end, points.subList(start, end)));
        }
        return trips;
    }
}
