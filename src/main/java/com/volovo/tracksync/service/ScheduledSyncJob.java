package com.volovo.tracksync.service;

import com.volovo.tracksync.config.TrackSyncProperties;
import com.volovo.tracksync.dto.SyncReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodic catch-up sync of the configured devices, cursor-driven.
 * Enabled with {@code tracksync.sync.schedule.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "tracksync.sync.schedule", name = "enabled", havingValue = "true")
@Slf4j
public class ScheduledSyncJob {

    private final TrackSyncService trackSyncService;
    private final TrackSyncProperties.Sync sync;

    public ScheduledSyncJob(TrackSyncService trackSyncService, TrackSyncProperties properties) {
        this.trackSyncService = trackSyncService;
        this.sync = properties.getSync();
    }

    @Scheduled(cron = "${tracksync.sync.schedule.cron:0 */30 * * * *}")
    public void syncConfiguredDevices() {
        List<Long> deviceIds = sync.getDeviceIds();
        if (deviceIds.isEmpty()) {
            log.warn("Scheduled sync skipped: tracksync.sync.device-ids is empty");
            return;
        }
        if (trackSyncService.isRunning()) {
            log.info("Scheduled sync skipped: previous run still in progress");
            return;
        }
        try {
            SyncReport report = trackSyncService.sync(SyncCommand.cursorDriven(deviceIds));
            if (report.exitCode() != SyncReport.EXIT_OK) {
                log.warn("Scheduled sync finished with exit code {}", report.exitCode());
            }
        } catch (IllegalStateException e) {
            log.info("Scheduled sync skipped: {}", e.getMessage());
        }
    }
}
