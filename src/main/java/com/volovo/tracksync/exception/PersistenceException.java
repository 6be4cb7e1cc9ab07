package com.volovo.tracksync.exception;

/**
 * A point batch could not be written. The batch does not count as flushed
 * and the device cursor must stay where it was.
 */
public class PersistenceException extends TrackSyncException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
