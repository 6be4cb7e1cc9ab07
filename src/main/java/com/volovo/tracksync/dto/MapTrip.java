package com.volovo.tracksync.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * One trip ready for a map layer. {@code points} is thinned with {@code stride};
 * {@code pointCount} is the trip's full size.
 */
@Value
@Builder
public class MapTrip {

    int index;
    double distanceKm;
    LocalDateTime startTime;
    LocalDateTime endTime;
    int pointCount;
    int stride;
    List<MapPoint> points;

    public record MapPoint(double lat, double lon, LocalDateTime time) {
    }
}
