package com.volovo.tracksync.controller;

import com.volovo.tracksync.config.TrackSyncProperties;
import com.volovo.tracksync.dto.ApiResponse;
import com.volovo.tracksync.dto.SyncReport;
import com.volovo.tracksync.dto.SyncRequest;
import com.volovo.tracksync.service.SyncCommand;
import com.volovo.tracksync.service.TrackSyncService;
import com.volovo.tracksync.session.SessionManager;
import com.volovo.tracksync.util.PortalTimes;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Triggers a sync run over HTTP. The call blocks until the run is finished.
 */
@RestController
@RequestMapping("/api/sync")
@RequiredArgsConstructor
@Slf4j
public class SyncController {

    private final TrackSyncService trackSyncService;
    private final SessionManager sessionManager;
    private final TrackSyncProperties properties;

    /**
     * POST /api/sync
     *
     * 200 when at least one device synced, 502 when the portal login failed,
     * 500 when every device failed.
     */
    @PostMapping
    public ResponseEntity<ApiResponse> sync(@Valid @RequestBody(required = false) SyncRequest request) {
        SyncRequest body = request != null ? request : new SyncRequest();
        List<Long> deviceIds = body.getOids() != null && !body.getOids().isEmpty()
                ? List.copyOf(new TreeSet<>(body.getOids()))
                : List.copyOf(new TreeSet<>(properties.getSync().getDeviceIds()));
        if (deviceIds.isEmpty()) {
            return ResponseEntity.badRequest()
                    .body(ApiResponse.error("No device ids: pass oids or set tracksync.sync.device-ids"));
        }

        SyncCommand command = new SyncCommand(deviceIds,
                body.getDtFrom() == null || body.getDtFrom().isBlank() ? null : PortalTimes.parse(body.getDtFrom()),
                body.getDtTo() == null || body.getDtTo().isBlank() ? null : PortalTimes.parse(body.getDtTo()),
                body.getChunkHours(),
                body.isResetState());
        log.info("Sync requested over HTTP for {} device(s)", deviceIds.size());

        SyncReport report = trackSyncService.sync(command);
        HttpStatus status = HttpStatus.OK;
        if (report.isAuthenticationFailed()) {
            status = HttpStatus.BAD_GATEWAY;
        } else if (report.exitCode() != SyncReport.EXIT_OK) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return ResponseEntity.status(status)
                .body(ApiResponse.builder()
                        .success(status == HttpStatus.OK)
                        .message(report.isAuthenticationFailed()
                                ? "Portal login failed: " + report.getAuthenticationError()
                                : "Synced " + report.getDevices().size() + " device(s), "
                                        + report.getFailedDevices() + " failed")
                        .data(report)
                        .build());
    }

    /**
     * GET /api/sync/status
     */
    @GetMapping("/status")
    public ResponseEntity<ApiResponse> status() {
        return ResponseEntity.ok(ApiResponse.success(Map.of(
                "running", trackSyncService.isRunning(),
                "session", sessionManager.getState().name()), "Sync status"));
    }
}
