package com.volovo.tracksync.analysis;

import com.volovo.tracksync.model.FilterConfig;
import com.volovo.tracksync.model.TrackPoint;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Rejects GPS fixes that imply an impossible jump.
 *
 * The first point is always kept. Every later point is compared with the last
 * <em>kept</em> point and rejected when it lies more than {@code maxJumpKm} away, or
 * when the implied speed exceeds {@code maxSpeedKmh}. Speed is only checked when
 * time moved forward between the two points. A run of bad fixes is therefore
 * absorbed as a whole instead of each bad fix becoming the reference for the next.
 */
public final class NoiseFilter {

    private NoiseFilter() {
    }

    public record Stats(int original, int kept, int removed) {
    }

    public record Result(List<TrackPoint> kept, Stats stats) {
    }

    public static Result filterJumps(List<TrackPoint> points, FilterConfig config) {
        return filterJumps(points, config.maxJumpKm(), config.maxSpeedKmh());
    }

    public static Result filterJumps(List<TrackPoint> points, double maxJumpKm, double maxSpeedKmh) {
        List<TrackPoint> kept = new ArrayList<>(points.size());
        TrackPoint last = null;

        for (TrackPoint point : points) {
            if (last == null) {
                kept.add(point);
                last = point;
                continue;
            }

            double km = TrackDistance.between(last, point);
            if (km > maxJumpKm) {
                continue;
            }
            if (last.getTimestamp() != null && point.getTimestamp() != null) {
                long seconds = Duration.between(last.getTimestamp(), point.getTimestamp()).getSeconds();
                if (seconds > 0 && km / (seconds / 3600.0) > maxSpeedKmh) {
                    continue;
                }
            }
            kept.add(point);
            last = point;
        }

        return new Result(kept, new Stats(points.size(), kept.size(), points.size() - kept.size()));
    }
}
