package com.volovo.tracksync.fetch;

import com.volovo.tracksync.config.TrackSyncProperties;
import com.volovo.tracksync.model.TimeWindow;
import com.volovo.tracksync.util.PortalTimes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Optional on-disk copy of every track response, for replaying parser issues.
 */
@Component
@Slf4j
public class RawResponseArchive {

    private final TrackSyncProperties.Sync sync;

    public RawResponseArchive(TrackSyncProperties properties) {
        this.sync = properties.getSync();
    }

    public boolean isEnabled() {
        return sync.isSaveRaw();
    }

    public void store(long deviceId, TimeWindow window, String body) {
        if (!isEnabled() || body == null) {
            return;
        }
        Path target = sync.getRawDir().resolve(fileName(deviceId, window));
        try {
            Files.createDirectories(sync.getRawDir());
            Files.writeString(target, body, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Raw response for device {} window {} not archived: {}", deviceId, window, e.getMessage());
        }
    }

    static String fileName(long deviceId, TimeWindow window) {
        return "track_" + deviceId
                + "_" + safe(PortalTimes.format(window.from()))
                + "_" + safe(PortalTimes.format(window.to())) + ".json";
    }

    private static String safe(String time) {
        return time.replace(':', '-').replace(' ', '_');
    }
}
