package com.volovo.tracksync.exception;

/**
 * Base of every failure raised by the ingestion and analysis core.
 */
public class TrackSyncException extends RuntimeException {

    public TrackSyncException(String message) {
        super(message);
    }

    public TrackSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
