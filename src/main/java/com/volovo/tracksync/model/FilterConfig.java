package com.volovo.tracksync.model;

/**
 * Thresholds of the jump filter. Both are caller-tunable within fixed bounds.
 */
public record FilterConfig(double maxJumpKm, double maxSpeedKmh) {

    public static final double MIN_JUMP_KM = 0.0;
    public static final double MAX_JUMP_KM = 50.0;
    public static final double MIN_SPEED_KMH = 1.0;
    public static final double MAX_SPEED_KMH = 400.0;

    public static final FilterConfig DEFAULTS = new FilterConfig(1.0, 180.0);

    public FilterConfig {
        if (maxJumpKm < MIN_JUMP_KM || maxJumpKm > MAX_JUMP_KM) {
            throw new IllegalArgumentException(
                    "maxJumpKm must be within [" + MIN_JUMP_KM + ", " + MAX_JUMP_KM + "], got " + maxJumpKm);
        }
        if (maxSpeedKmh < MIN_SPEED_KMH || maxSpeedKmh > MAX_SPEED_KMH) {
            throw new IllegalArgumentException(
                    "maxSpeedKmh must be within [" + MIN_SPEED_KMH + ", " + MAX_SPEED_KMH + "], got " + maxSpeedKmh);
        }
    }
}
