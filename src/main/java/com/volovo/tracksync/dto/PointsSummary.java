package com.volovo.tracksync.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Counts and distances of one device over a period, raw and after the jump filter.
 */
@Value
@Builder
public class PointsSummary {

    long deviceId;
    LocalDateTime from;
    LocalDateTime to;

    int rawCount;
    int filteredCount;
    int removedCount;

    double rawDistanceKm;
    double totalDistanceKm;

    int geofenceEntries;
    /** Filtered points before the first loading-site entry */
    int leadingPointCount;

    int tripCount;
    int tripsAboveMinKm;

    double minTripKm;
    double maxJumpKm;
    double maxSpeedKmh;
}
