package com.volovo.tracksync.service;

import com.volovo.tracksync.config.TrackSyncProperties;
import com.volovo.tracksync.exception.PersistenceException;
import com.volovo.tracksync.model.PointKeyStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.List;

/**
 * Deduplicating upsert of parsed points.
 *
 * Writing the same points twice leaves the store as after the first write;
 * the second call only reports matches. Input is flushed in slices of at most
 * {@code tracksync.sync.buffer-limit} points, each committed on its own, so a
 * failure leaves earlier slices stored.
 */
@Service
@Slf4j
public class IdempotentPointWriter {

    private final PointBatchFlusher flusher;
    private final TrackSyncProperties.Sync sync;

    public IdempotentPointWriter(PointBatchFlusher flusher, TrackSyncProperties properties) {
        this.flusher = flusher;
        this.sync = properties.getSync();
    }

    /**
     * @throws PersistenceException when a slice cannot be stored; slices flushed before it stay stored
     */
    public WriteResult writeBatch(List<PendingPoint> points) {
        return writeBatch(points, sync.getKeyStrategy());
    }

    public WriteResult writeBatch(List<PendingPoint> points, PointKeyStrategy keyStrategy) {
        if (points == null || points.isEmpty()) {
            return WriteResult.EMPTY;
        }

        int limit = Math.max(1, sync.getBufferLimit());
        WriteResult total = WriteResult.EMPTY;
        for (int start = 0; start < points.size(); start += limit) {
            List<PendingPoint> slice = points.subList(start, Math.min(points.size(), start + limit));
            try {
                total = total.plus(flusher.flush(slice, keyStrategy));
            } catch (DataAccessException | TransactionException e) {
                log.error("Flush of {} point(s) failed after {} stored", slice.size(), start, e);
                throw new PersistenceException("Could not store " + slice.size() + " point(s)", e);
            }
        }
        log.debug("Wrote {} point(s): {}", points.size(), total);
        return total;
    }
}
