package com.volovo.tracksync.exception;

import com.volovo.tracksync.model.TimeWindow;
import lombok.Getter;

/**
 * A window could not be fetched after all attempts. Aborts only that window.
 */
@Getter
public class FetchException extends TrackSyncException {

    private final long deviceId;

    private final TimeWindow window;

    public FetchException(long deviceId, TimeWindow window, String message, Throwable cause) {
        super("Device " + deviceId + " window " + window + ": " + message, cause);
        this.deviceId = deviceId;
        this.window = window;
    }

    public FetchException(long deviceId, TimeWindow window, String message) {
        this(deviceId, window, message, null);
    }
}
