package com.volovo.tracksync.config;

import com.volovo.tracksync.dto.DeviceSyncResult;
import com.volovo.tracksync.dto.SyncReport;
import com.volovo.tracksync.service.SyncCommand;
import com.volovo.tracksync.service.TrackSyncService;
import com.volovo.tracksync.util.PortalTimes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * One-shot sync from the command line; the process exits when it is done.
 *
 * Exit codes: 0 all or some devices synced, 1 every device failed,
 * 2 bad arguments, 3 no portal session.
 */
@Component
@Slf4j
public class SyncCommandLineRunner implements ApplicationRunner {

    private final TrackSyncService trackSyncService;
    private final TrackSyncProperties properties;
    private final ConfigurableApplicationContext context;

    public SyncCommandLineRunner(TrackSyncService trackSyncService,
                                 TrackSyncProperties properties,
                                 ConfigurableApplicationContext context) {
        this.trackSyncService = trackSyncService;
        this.properties = properties;
        this.context = context;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!SyncArguments.isSyncRequested(args)) {
            return;
        }
        int exitCode = execute(args);
        System.exit(SpringApplication.exit(context, () -> exitCode));
    }

    int execute(ApplicationArguments args) {
        SyncCommand command;
        try {
            command = SyncArguments.toCommand(args, properties.getSync().getDeviceIds());
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            return SyncReport.EXIT_BAD_ARGUMENTS;
        }
        if (args.containsOption(SyncArguments.SAVE_RAW)) {
            properties.getSync().setSaveRaw(true);
        }

        SyncReport report = trackSyncService.sync(command);
        printReport(report);
        return report.exitCode();
    }

    private static void printReport(SyncReport report) {
        log.info("========================================");
        for (DeviceSyncResult device : report.getDevices()) {
            log.info("Device {}: {} | {} → {} | fetched {}, inserted {}, matched {}, failed windows {}/{}{}",
                    device.getDeviceId(), device.getStatus(),
                    device.getFrom() == null ? "-" : PortalTimes.format(device.getFrom()),
                    device.getTo() == null ? "-" : PortalTimes.format(device.getTo()),
                    device.getFetched(), device.getInserted(), device.getMatched(),
                    device.getFailedWindows(), device.getWindows(),
                    device.getError() == null ? "" : " | " + device.getError());
        }
        if (report.isAuthenticationFailed()) {
            log.error("Portal login failed: {}", report.getAuthenticationError());
        }
        log.info("Total: fetched {}, inserted {}, matched {}",
                report.getTotalFetched(), report.getTotalInserted(), report.getTotalMatched());
        log.info("========================================");
    }
}
