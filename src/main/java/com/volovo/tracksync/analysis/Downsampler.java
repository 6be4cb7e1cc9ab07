package com.volovo.tracksync.analysis;

import java.util.ArrayList;
import java.util.List;

/**
 * Stride-based thinning for map display.
 *
 * With {@code n > maxPoints}, {@code stride = n / maxPoints} and every stride-th point
 * is kept starting at the first. When the stride would skip the final point, it
 * takes the place of the last sampled one, so the result keeps both endpoints and
 * has {@code ceil(n / stride)} points.
 */
public final class Downsampler {

    private Downsampler() {
    }

    public record Decimation<T>(List<T> sampled, int stride) {
    }

    public static <T> Decimation<T> decimate(List<T> points, int maxPoints) {
        if (maxPoints < 1) {
            throw new IllegalArgumentException("maxPoints must be positive, got " + maxPoints);
        }
        int n = points.size();
        if (n <= maxPoints) {
            return new Decimation<>(points, 1);
        }

        int stride = Math.max(1, n / maxPoints);
        List<T> sampled = new ArrayList<>((n + stride - 1) / stride);
        for (int i = 0; i < n; i += stride) {
            sampled.add(points.get(i));
        }
        if ((n - 1) % stride != 0) {
            if (sampled.size() > 1) {
                sampled.set(sampled.size() - 1, points.get(n - 1));
            } else {
                sampled.add(points.get(n - 1));
            }
        }
        return new Decimation<>(sampled, stride);
    }
}
