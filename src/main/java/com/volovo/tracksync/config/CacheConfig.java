package com.volovo.tracksync.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.cache.support.SimpleCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Caffeine caches.
 *
 *   deviceCatalogue: devices with stored points and their counts. A GROUP BY over
 *                    the whole points table, only changing when a sync writes.
 *                    Evicted after every sync run; TTL 10 minutes as a backstop.
 */
@Configuration
@EnableCaching
@Slf4j
public class CacheConfig {

    public static final String CACHE_DEVICE_CATALOGUE = "deviceCatalogue";

    @Bean
    public CacheManager cacheManager() {
        log.info("[CACHE] Initialising Caffeine CacheManager, caches: '{}'", CACHE_DEVICE_CATALOGUE);

        SimpleCacheManager manager = new SimpleCacheManager();
        manager.setCaches(List.of(
                buildCache(CACHE_DEVICE_CATALOGUE, 10, 50)   // one entry per requested limit
        ));
        return manager;
    }

    private CaffeineCache buildCache(String name, int ttlMinutes, int maxSize) {
        return new CaffeineCache(name,
                Caffeine.newBuilder()
                        .expireAfterWrite(ttlMinutes, TimeUnit.MINUTES)
                        .maximumSize(maxSize)
                        .recordStats()
                        .build());
    }
}
