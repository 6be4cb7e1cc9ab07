package com.volovo.tracksync.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * What one device's sync fetched, stored and skipped.
 */
@Value
@Builder
public class DeviceSyncResult {

    public enum Status {
        /** Every window fetched and stored */
        OK,
        /** Some windows failed; the rest were stored */
        PARTIAL,
        /** Nothing usable was stored */
        FAILED
    }

    long deviceId;
    Status status;

    LocalDateTime from;
    LocalDateTime to;

    int windows;
    int failedWindows;

    int fetched;
    int skipped;

    int matched;
    int inserted;
    int modified;
    int conflicts;

    /** Cursor after the run; {@code null} when it did not move */
    LocalDateTime cursorAdvancedTo;

    String error;

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
