package com.volovo.tracksync.exception;

/**
 * A single point record has an encoding the parser does not understand.
 * The record is dropped and counted, the window carries on.
 */
public class UpstreamFormatException extends TrackSyncException {

    public UpstreamFormatException(String message) {
        super(message);
    }

    public UpstreamFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
