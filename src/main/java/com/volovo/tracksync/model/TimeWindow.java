package com.volovo.tracksync.model;

import com.volovo.tracksync.util.PortalTimes;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Half-open interval {@code [from, to)} fetched as one upstream request.
 */
public record TimeWindow(LocalDateTime from, LocalDateTime to) {

    public TimeWindow {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Window bounds are required");
        }
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Window ends before it starts: " + from + " > " + to);
        }
    }

    /**
     * Splits {@code [from, to)} into consecutive windows of {@code chunkHours}
     * (at least one hour); the last window is clipped to {@code to}.
     */
    public static List<TimeWindow> chunk(LocalDateTime from, LocalDateTime to, int chunkHours) {
        Duration step = Duration.ofHours(Math.max(1, chunkHours));
        List<TimeWindow> windows = new ArrayList<>();
        LocalDateTime cursor = from;
        while (cursor.isBefore(to)) {
            LocalDateTime next = cursor.plus(step);
            if (next.isAfter(to)) {
                next = to;
            }
            windows.add(new TimeWindow(cursor, next));
            cursor = next;
        }
        return windows;
    }

    /** Stable identifier used in storage keys and log lines */
    public String id() {
        return PortalTimes.format(from) + "|" + PortalTimes.format(to);
    }

    @Override
    public String toString() {
        return PortalTimes.format(from) + " → " + PortalTimes.format(to);
    }
}
