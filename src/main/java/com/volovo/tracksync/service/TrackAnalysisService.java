package com.volovo.tracksync.service;

import com.volovo.tracksync.analysis.Downsampler;
import com.volovo.tracksync.analysis.NoiseFilter;
import com.volovo.tracksync.analysis.TrackDistance;
import com.volovo.tracksync.analysis.Trip;
import com.volovo.tracksync.analysis.TripSegmenter;
import com.volovo.tracksync.config.TrackSyncProperties;
import com.volovo.tracksync.dto.MapTrip;
import com.volovo.tracksync.dto.PointsSummary;
import com.volovo.tracksync.entity.TrackPointRecord;
import com.volovo.tracksync.model.FilterConfig;
import com.volovo.tracksync.model.Geofence;
import com.volovo.tracksync.model.TrackPoint;
import com.volovo.tracksync.repository.TrackPointRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Read path over stored points: jump filter → trip segmentation → thinning.
 * Holds no state between calls.
 */
@Service
@Slf4j
public class TrackAnalysisService {

    private final TrackPointRepository trackPointRepository;
    private final TrackSyncProperties.Analysis analysis;
    private final Geofence geofence;

    public TrackAnalysisService(TrackPointRepository trackPointRepository, TrackSyncProperties properties) {
        this.trackPointRepository = trackPointRepository;
        this.analysis = properties.getAnalysis();
        TrackSyncProperties.Geofence site = properties.getGeofence();
        this.geofence = new Geofence(site.getLatitude(), site.getLongitude(), site.getRadiusKm());
    }

    @Transactional(readOnly = true)
    public PointsSummary summarize(long deviceId, LocalDateTime from, LocalDateTime to, FilterConfig filter) {
        List<TrackPoint> raw = loadTrack(deviceId, from, to);
        NoiseFilter.Result filtered = NoiseFilter.filterJumps(raw, filter);
        TripSegmenter.Segmentation segmentation = TripSegmenter.splitTrips(filtered.kept(), geofence);

        double minTripKm = analysis.getMinTripKm();
        int aboveMin = (int) segmentation.trips().stream()
                .filter(trip -> trip.distanceKm() >= minTripKm)
                .count();

        return PointsSummary.builder()
                .deviceId(deviceId)
                .from(from)
                .to(to)
                .rawCount(filtered.stats().original())
                .filteredCount(filtered.stats().kept())
                .removedCount(filtered.stats().removed())
                .rawDistanceKm(round3(TrackDistance.totalKm(raw)))
                .totalDistanceKm(round3(TrackDistance.totalKm(filtered.kept())))
                .geofenceEntries(segmentation.entryIndices().size())
                .leadingPointCount(segmentation.leadingPointCount())
                .tripCount(segmentation.trips().size())
                .tripsAboveMinKm(aboveMin)
                .minTripKm(minTripKm)
                .maxJumpKm(filter.maxJumpKm())
                .maxSpeedKmh(filter.maxSpeedKmh())
                .build();
    }

    public List<MapTrip> tripsForMap(long deviceId, LocalDateTime from, LocalDateTime to, FilterConfig filter) {
        return tripsForMap(deviceId, from, to, filter, analysis.getMaxPointsPerTrip(), analysis.getMinTripKm());
    }

    /**
     * Trips with at least two points and {@code minTripKm}, numbered from 1 in time order.
     */
    @Transactional(readOnly = true)
    public List<MapTrip> tripsForMap(long deviceId, LocalDateTime from, LocalDateTime to, FilterConfig filter,
                                     int maxPointsPerTrip, double minTripKm) {
        List<TrackPoint> kept = NoiseFilter.filterJumps(loadTrack(deviceId, from, to), filter).kept();
        List<Trip> trips = TripSegmenter.splitTrips(kept, geofence).trips();

        List<MapTrip> result = new ArrayList<>();
        for (Trip trip : trips) {
            if (trip.size() < 2) {
                continue;
            }
            double km = trip.distanceKm();
            if (km < minTripKm) {
                continue;
            }
            Downsampler.Decimation<TrackPoint> thinned = Downsampler.decimate(trip.points(), maxPointsPerTrip);
            result.add(MapTrip.builder()
                    .index(result.size() + 1)
                    .distanceKm(round3(km))
                    .startTime(trip.startTime())
                    .endTime(trip.endTime())
                    .pointCount(trip.size())
                    .stride(thinned.stride())
                    .points(thinned.sampled().stream()
                            .map(p -> new MapTrip.MapPoint(p.getLatitude(), p.getLongitude(), p.getTimestamp()))
                            .toList())
                    .build());
        }
        log.debug("Device {}: {} trip(s) for map out of {}", deviceId, result.size(), trips.size());
        return result;
    }

    List<TrackPoint> loadTrack(long deviceId, LocalDateTime from, LocalDateTime to) {
        int limit = Math.max(1, analysis.getPointLimit());
        List<TrackPointRecord> rows = trackPointRepository.findTrack(deviceId, from, to, PageRequest.of(0, limit));
        if (rows.size() == limit) {
            log.warn("Device {}: point limit {} reached, later points ignored", deviceId, limit);
        }
        return rows.stream().map(TrackAnalysisService::toPoint).toList();
    }

    static TrackPoint toPoint(TrackPointRecord row) {
        return TrackPoint.builder()
                .deviceId(row.getDeviceId())
                .timestamp(row.getRecordedAt())
                .latitude(row.getLatitude())
                .longitude(row.getLongitude())
                .sequenceIndex(row.getSequenceIndex())
                .speed(row.getSpeed())
                .direction(row.getDirection())
                .odometerDelta(row.getOdometerDelta())
                .status(row.getStatus())
                .width(row.getWidth())
                .build();
    }

    private static double round3(double km) {
        return Math.round(km * 1000.0) / 1000.0;
    }
}
