package com.volovo.tracksync.service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Parameters of one sync run.
 *
 * @param deviceIds  devices in processing order
 * @param from       forced start, else the device cursor
 * @param to         forced end, else now
 * @param chunkHours window length, {@code null} for the configured default
 * @param resetState restart every device from the first day of the month
 */
public record SyncCommand(List<Long> deviceIds, LocalDateTime from, LocalDateTime to,
                          Integer chunkHours, boolean resetState) {

    public SyncCommand {
        deviceIds = deviceIds == null ? List.of() : List.copyOf(deviceIds);
        if (from != null && to != null && !to.isAfter(from)) {
            throw new IllegalArgumentException("Sync end " + to + " must be after start " + from);
        }
        if (chunkHours != null && chunkHours < 1) {
            throw new IllegalArgumentException("chunkHours must be at least 1, got " + chunkHours);
        }
    }

    public static SyncCommand cursorDriven(List<Long> deviceIds) {
        return new SyncCommand(deviceIds, null, null, null, false);
    }
}
