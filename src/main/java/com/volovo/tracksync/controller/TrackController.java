package com.volovo.tracksync.controller;

import com.volovo.tracksync.config.TrackSyncProperties;
import com.volovo.tracksync.dto.ApiResponse;
import com.volovo.tracksync.dto.DeviceSummary;
import com.volovo.tracksync.dto.MapTrip;
import com.volovo.tracksync.dto.PointsSummary;
import com.volovo.tracksync.model.FilterConfig;
import com.volovo.tracksync.service.DeviceCatalogService;
import com.volovo.tracksync.service.TrackAnalysisService;
import com.volovo.tracksync.util.PortalTimes;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Read-only views over stored tracks.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Validated
@Slf4j
public class TrackController {

    private final TrackAnalysisService trackAnalysisService;
    private final DeviceCatalogService deviceCatalogService;
    private final TrackSyncProperties properties;

    /**
     * GET /api/points_summary
     *
     * Raw and filtered point counts, distances, loading-site entries and trip counts.
     */
    @GetMapping("/points_summary")
    public ResponseEntity<ApiResponse> pointsSummary(
            @RequestParam("oid") long oid,
            @RequestParam(value = "dt_from", required = false) String dtFrom,
            @RequestParam(value = "dt_to", required = false) String dtTo,
            @RequestParam(value = "max_jump_km", required = false)
            @DecimalMin("0.0") @DecimalMax("50.0") Double maxJumpKm,
            @RequestParam(value = "max_speed_kmh", required = false)
            @DecimalMin("1.0") @DecimalMax("400.0") Double maxSpeedKmh) {

        FilterConfig filter = filterConfig(maxJumpKm, maxSpeedKmh);
        PointsSummary summary = trackAnalysisService.summarize(oid, time(dtFrom), time(dtTo), filter);
        log.debug("points_summary oid={} raw={} filtered={} trips={}",
                oid, summary.getRawCount(), summary.getFilteredCount(), summary.getTripCount());
        return ResponseEntity.ok(ApiResponse.success(summary, "Summary for device " + oid));
    }

    /**
     * GET /api/trips_for_map
     *
     * Trips of at least {@code tracksync.analysis.min-trip-km}, each thinned to {@code max_points}.
     */
    @GetMapping("/trips_for_map")
    public ResponseEntity<ApiResponse> tripsForMap(
            @RequestParam("oid") long oid,
            @RequestParam(value = "dt_from", required = false) String dtFrom,
            @RequestParam(value = "dt_to", required = false) String dtTo,
            @RequestParam(value = "max_points", required = false) @Min(200) @Max(20000) Integer maxPoints,
            @RequestParam(value = "max_jump_km", required = false)
            @DecimalMin("0.0") @DecimalMax("50.0") Double maxJumpKm,
            @RequestParam(value = "max_speed_kmh", required = false)
            @DecimalMin("1.0") @DecimalMax("400.0") Double maxSpeedKmh) {

        TrackSyncProperties.Analysis analysis = properties.getAnalysis();
        int limit = maxPoints != null ? maxPoints : analysis.getMaxPointsPerTrip();
        List<MapTrip> trips = trackAnalysisService.tripsForMap(oid, time(dtFrom), time(dtTo),
                filterConfig(maxJumpKm, maxSpeedKmh), limit, analysis.getMinTripKm());
        return ResponseEntity.ok(ApiResponse.success(trips, trips.size() + " trip(s) for device " + oid));
    }

    /**
     * GET /api/oids
     */
    @GetMapping("/oids")
    public ResponseEntity<ApiResponse> devices(
            @RequestParam(value = "limit", defaultValue = "500") @Min(1) @Max(5000) int limit) {
        List<DeviceSummary> devices = deviceCatalogService.listDevices(limit);
        return ResponseEntity.ok(ApiResponse.success(devices, devices.size() + " device(s)"));
    }

    private FilterConfig filterConfig(Double maxJumpKm, Double maxSpeedKmh) {
        TrackSyncProperties.Analysis analysis = properties.getAnalysis();
        return new FilterConfig(
                maxJumpKm != null ? maxJumpKm : analysis.getMaxJumpKm(),
                maxSpeedKmh != null ? maxSpeedKmh : analysis.getMaxSpeedKmh());
    }

    private static LocalDateTime time(String text) {
        return text == null || text.isBlank() ? null : PortalTimes.parse(text);
    }
}
