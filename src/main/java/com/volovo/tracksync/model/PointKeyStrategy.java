package com.volovo.tracksync.model;

import com.volovo.tracksync.util.PortalTimes;

/**
 * How a stored point is identified for deduplication.
 */
public enum PointKeyStrategy {

    /** {@code deviceId|timestamp}: stable across re-runs and overlapping windows */
    TIMESTAMP {
        @Override
        public String keyOf(TrackPoint point, TimeWindow window) {
            return point.getDeviceId() + "|" + PortalTimes.format(point.getTimestamp());
        }
    },

    /**
     * {@code deviceId|window|sequenceIndex}: for sources whose ticks repeat
     * across adjoining chunk boundaries. Only stable while windows are replayed
     * with identical bounds.
     */
    WINDOW_SEQUENCE {
        @Override
        public String keyOf(TrackPoint point, TimeWindow window) {
            if (point.getSequenceIndex() == null) {
                throw new IllegalArgumentException("Point has no sequence index: " + point);
            }
            return point.getDeviceId() + "|" + window.id() + "|" + point.getSequenceIndex();
        }
    };

    public abstract String keyOf(TrackPoint point, TimeWindow window);
}
