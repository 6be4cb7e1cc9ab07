package com.volovo.tracksync.service;

import com.volovo.tracksync.entity.TrackPointRecord;
import com.volovo.tracksync.model.PointKeyStrategy;
import com.volovo.tracksync.model.TimeWindow;
import com.volovo.tracksync.model.TrackPoint;
import com.volovo.tracksync.repository.TrackPointRepository;
import com.volovo.tracksync.util.GeoUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Upserts one bounded batch in its own transaction.
 *
 * Lives apart from {@link IdempotentPointWriter} so that each call goes through
 * the Spring proxy: a failing batch rolls back alone and earlier batches stay committed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PointBatchFlusher {

    // Coordinates closer than this are the same fix
    static final double SAME_POSITION_KM = 0.001;

    private final TrackPointRepository trackPointRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public WriteResult flush(List<PendingPoint> batch, PointKeyStrategy keyStrategy) {
        List<String> keys = new ArrayList<>(batch.size());
        for (PendingPoint pending : batch) {
            keys.add(keyStrategy.keyOf(pending.point(), pending.sourceWindow()));
        }

        Map<String, TrackPointRecord> known = new HashMap<>();
        for (TrackPointRecord existing : trackPointRepository.findByPointKeyIn(keys)) {
            known.put(existing.getPointKey(), existing);
        }

        Map<String, TrackPointRecord> dirty = new LinkedHashMap<>();
        int matched = 0, inserted = 0, modified = 0, conflicts = 0;

        for (int i = 0; i < batch.size(); i++) {
            PendingPoint pending = batch.get(i);
            String key = keys.get(i);
            TrackPointRecord row = known.get(key);

            if (row == null) {
                row = newRecord(key, pending);
                known.put(key, row);
                dirty.put(key, row);
                inserted++;
                continue;
            }

            matched++;
            if (sameValues(row, pending.point())) {
                continue;
            }
            if (movedApart(row, pending.point()) && !sameWindow(row, pending.sourceWindow())) {
                conflicts++;
                log.warn("Key {} already stored at ({}, {}) from window {}..{}; keeping it over ({}, {})",
                        key, row.getLatitude(), row.getLongitude(), row.getSourceWindowFrom(), row.getSourceWindowTo(),
                        pending.point().getLatitude(), pending.point().getLongitude());
                continue;
            }
            apply(row, pending);
            dirty.put(key, row);
            modified++;
        }

        if (!dirty.isEmpty()) {
            trackPointRepository.saveAll(dirty.values());
        }
        return new WriteResult(matched, inserted, modified, conflicts);
    }

    private static TrackPointRecord newRecord(String key, PendingPoint pending) {
        TrackPointRecord row = new TrackPointRecord();
        row.setPointKey(key);
        row.setDeviceId(pending.point().getDeviceId());
        apply(row, pending);
        return row;
    }

    private static void apply(TrackPointRecord row, PendingPoint pending) {
        TrackPoint p = pending.point();
        row.setRecordedAt(p.getTimestamp());
        row.setLatitude(p.getLatitude());
        row.setLongitude(p.getLongitude());
        row.setSequenceIndex(p.getSequenceIndex());
        row.setSpeed(p.getSpeed());
        row.setDirection(p.getDirection());
        row.setOdometerDelta(p.getOdometerDelta());
        row.setStatus(p.getStatus());
        row.setWidth(p.getWidth());
        row.setRunKey(pending.runKey());
        row.setSourceWindowFrom(pending.sourceWindow().from());
        row.setSourceWindowTo(pending.sourceWindow().to());
    }

    static boolean sameValues(TrackPointRecord row, TrackPoint p) {
        return Objects.equals(row.getRecordedAt(), p.getTimestamp())
                && Objects.equals(row.getLatitude(), p.getLatitude())
                && Objects.equals(row.getLongitude(), p.getLongitude())
                && Objects.equals(row.getSequenceIndex(), p.getSequenceIndex())
                && Objects.equals(row.getSpeed(), p.getSpeed())
                && Objects.equals(row.getDirection(), p.getDirection())
                && Objects.equals(row.getOdometerDelta(), p.getOdometerDelta())
                && Objects.equals(row.getStatus(), p.getStatus())
                && Objects.equals(row.getWidth(), p.getWidth());
    }

    private static boolean movedApart(TrackPointRecord row, TrackPoint p) {
        return GeoUtil.distanceKm(row.getLatitude(), row.getLongitude(), p.getLatitude(), p.getLongitude())
                > SAME_POSITION_KM;
    }

    private static boolean sameWindow(TrackPointRecord row, TimeWindow window) {
        return window.from().equals(row.getSourceWindowFrom()) && window.to().equals(row.getSourceWindowTo());
    }
}
