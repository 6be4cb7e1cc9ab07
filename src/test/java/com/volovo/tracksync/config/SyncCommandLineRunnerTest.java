package com.volovo.tracksync.config;

import com.volovo.tracksync.dto.DeviceSyncResult;
import com.volovo.tracksync.dto.SyncReport;
import com.volovo.tracksync.service.TrackSyncService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SyncCommandLineRunnerTest {

    @Mock private TrackSyncService               trackSyncService;
    @Mock private ConfigurableApplicationContext context;

    private TrackSyncProperties properties;
    private SyncCommandLineRunner runner;

    @BeforeEach
    void setUp() {
        properties = new TrackSyncProperties();
        runner = new SyncCommandLineRunner(trackSyncService, properties, context);
    }

    private static SyncReport report(String authError, DeviceSyncResult.Status... statuses) {
        SyncReport.SyncReportBuilder builder = SyncReport.builder()
                .startedAt(LocalDateTime.now()).finishedAt(LocalDateTime.now()).authenticationError(authError);
        long id = 1;
        for (DeviceSyncResult.Status status : statuses) {
            builder.device(DeviceSyncResult.builder().deviceId(id++).status(status).build());
        }
        return builder.build();
    }

    @Test
    @DisplayName("Bad arguments give exit code 2 without starting a run")
    void badArguments() {
        assertThat(runner.execute(new DefaultApplicationArguments("--sync", "--oids=x"))).isEqualTo(2);
        assertThat(runner.execute(new DefaultApplicationArguments("--sync"))).isEqualTo(2);
        assertThat(runner.execute(new DefaultApplicationArguments(
                "--sync", "--oids=1", "--from=2026-02-02 00:00:00", "--to=2026-02-02 00:00:00"))).isEqualTo(2);
        verifyNoInteractions(trackSyncService);
    }

    @Test
    @DisplayName("Exit code follows the report: partial success 0, all failed 1, no session 3")
    void exitCodes() {
        when(trackSyncService.sync(any()))
                .thenReturn(report(null, DeviceSyncResult.Status.OK, DeviceSyncResult.Status.FAILED))
                .thenReturn(report(null, DeviceSyncResult.Status.FAILED, DeviceSyncResult.Status.FAILED))
                .thenReturn(report("REJECTED: login rejected"));

        DefaultApplicationArguments args = new DefaultApplicationArguments("--sync", "--oids=1,2");

        assertThat(runner.execute(args)).isEqualTo(0);
        assertThat(runner.execute(args)).isEqualTo(1);
        assertThat(runner.execute(args)).isEqualTo(3);
    }

    @Test
    @DisplayName("--save-raw switches on the raw response archive")
    void saveRaw() {
        when(trackSyncService.sync(any())).thenReturn(report(null, DeviceSyncResult.Status.OK));
        properties.getSync().setDeviceIds(List.of(182L));

        runner.execute(new DefaultApplicationArguments("--sync", "--save-raw"));

        assertThat(properties.getSync().isSaveRaw()).isTrue();
    }

    @Test
    @DisplayName("Without --sync the runner does nothing")
    void notRequested() {
        runner.run(new DefaultApplicationArguments("--server.port=0"));

        verifyNoInteractions(trackSyncService);
    }
}
