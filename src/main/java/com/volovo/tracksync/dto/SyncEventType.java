package com.volovo.tracksync.dto;

/**
 * Progress events pushed to {@code /topic/sync-events}.
 */
public enum SyncEventType {
    DEVICE_SYNCED,
    DEVICE_FAILED,
    RUN_FINISHED
}
