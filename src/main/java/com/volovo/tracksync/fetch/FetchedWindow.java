package com.volovo.tracksync.fetch;

import com.volovo.tracksync.exception.FetchException;
import com.volovo.tracksync.model.TimeWindow;
import com.volovo.tracksync.model.TrackPoint;

import java.util.List;

/**
 * Outcome of one window: parsed points, or the failure that aborted it.
 */
public record FetchedWindow(TimeWindow window, List<TrackPoint> points, int skipped, FetchException failure) {

    public static FetchedWindow succeeded(TimeWindow window, List<TrackPoint> points, int skipped) {
        return new FetchedWindow(window, List.copyOf(points), skipped, null);
    }

    public static FetchedWindow failed(TimeWindow window, FetchException failure) {
        return new FetchedWindow(window, List.of(), 0, failure);
    }

    public boolean isFailed() {
        return failure != null;
    }
}
