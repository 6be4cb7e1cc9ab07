package com.volovo.tracksync.service;

import com.volovo.tracksync.config.CacheConfig;
import com.volovo.tracksync.dto.DeviceSummary;
import com.volovo.tracksync.repository.TrackPointRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Devices that have stored points, behind the Caffeine cache.
 *
 * Kept in its own bean: {@code @Cacheable} only applies to calls through the proxy.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeviceCatalogService {

    private final TrackPointRepository trackPointRepository;

    @Cacheable(value = CacheConfig.CACHE_DEVICE_CATALOGUE, key = "#limit")
    public List<DeviceSummary> listDevices(int limit) {
        log.debug("[CACHE MISS] device catalogue (limit {}), loading from DB", limit);
        return trackPointRepository.countByDevice(PageRequest.of(0, limit)).stream()
                .map(row -> new DeviceSummary(((Number) row[0]).longValue(), ((Number) row[1]).longValue()))
                .toList();
    }

    /** New points may have added devices; called after every sync run. */
    @CacheEvict(value = CacheConfig.CACHE_DEVICE_CATALOGUE, allEntries = true)
    public void evict() {
        log.debug("[CACHE EVICT] device catalogue cleared");
    }
}
