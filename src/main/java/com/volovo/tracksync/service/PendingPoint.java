package com.volovo.tracksync.service;

import com.volovo.tracksync.model.TimeWindow;
import com.volovo.tracksync.model.TrackPoint;

/**
 * A parsed point on its way to storage, with the window and run that produced it.
 */
public record PendingPoint(TrackPoint point, TimeWindow sourceWindow, String runKey) {
}
