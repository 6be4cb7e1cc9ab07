package com.volovo.tracksync.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * One canonical GPS fix of a device, whatever shape the portal delivered it in.
 * Latitude, longitude and timestamp are always present; the remaining
 * fields are copied from the source when it sends them.
 */
@Value
@Builder(toBuilder = true)
public class TrackPoint {

    long deviceId;

    /** Naive local wall-clock time as reported by the portal */
    LocalDateTime timestamp;

    double latitude;

    double longitude;

    /** Position inside the source window response, when known */
    Integer sequenceIndex;

    /** Instantaneous speed in km/h */
    Double speed;

    /** Heading ("dir") */
    Double direction;

    /** Odometer delta ("dst") */
    Double odometerDelta;

    /** Raw device status ("st") */
    String status;

    /** Raw "width" attribute */
    String width;
}
