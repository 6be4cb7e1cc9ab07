package com.volovo.tracksync.service;

import com.volovo.tracksync.entity.SyncCursor;
import com.volovo.tracksync.repository.SyncCursorRepository;
import com.volovo.tracksync.util.PortalTimes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Per-device sync watermark. A cursor that does not exist yet starts at the
 * first day of the current month.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SyncCursorStore {

    private final SyncCursorRepository syncCursorRepository;

    @Transactional
    public LocalDateTime read(long deviceId) {
        return syncCursorRepository.findById(deviceId)
                .map(SyncCursor::getLastSyncedAt)
                .orElseGet(() -> {
                    LocalDateTime start = PortalTimes.startOfCurrentMonth();
                    log.info("Device {}: no cursor yet, starting at {}", deviceId, PortalTimes.format(start));
                    syncCursorRepository.save(SyncCursor.builder().deviceId(deviceId).lastSyncedAt(start).build());
                    return start;
                });
    }

    /**
     * Moves the cursor forward to {@code syncedUntil}; never moves it back.
     */
    @Transactional
    public void advance(long deviceId, LocalDateTime syncedUntil) {
        SyncCursor cursor = syncCursorRepository.findById(deviceId)
                .orElseGet(() -> SyncCursor.builder().deviceId(deviceId).build());
        LocalDateTime previous = cursor.getLastSyncedAt();
        if (previous != null && !syncedUntil.isAfter(previous)) {
            log.debug("Device {}: cursor stays at {}", deviceId, PortalTimes.format(previous));
            return;
        }
        cursor.setLastSyncedAt(syncedUntil);
        syncCursorRepository.save(cursor);
        log.info("Device {}: cursor advanced to {}", deviceId, PortalTimes.format(syncedUntil));
    }

    /**
     * Sets the cursor to {@code syncedUntil} even when that is earlier than the
     * stored value. Used once a reset run has stored everything it fetched.
     */
    @Transactional
    public void rewind(long deviceId, LocalDateTime syncedUntil) {
        SyncCursor cursor = syncCursorRepository.findById(deviceId)
                .orElseGet(() -> SyncCursor.builder().deviceId(deviceId).build());
        cursor.setLastSyncedAt(syncedUntil);
        syncCursorRepository.save(cursor);
        log.info("Device {}: cursor reset to {}", deviceId, PortalTimes.format(syncedUntil));
    }
}
