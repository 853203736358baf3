package com.tubetrail.checkin.config;

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
 * Caching configuration using Caffeine.
 *
 *   stations          - single-station lookups by id (coordinates, radius, display name).
 *                       Hit on every check-in and on every duplicate message.
 *                       TTL: 30 minutes. Max entries: 2000.
 *
 *   stationCatalogue  - full catalogue list fed to the roundel name matcher.
 *                       TTL: 30 minutes. Single entry.
 *
 * StationDirectory.evictAll() clears both after a catalogue reload.
 */
@Configuration
@EnableCaching
@Slf4j
public class CacheConfig {

    public static final String CACHE_STATIONS = "stations";

    public static final String CACHE_STATION_CATALOGUE = "stationCatalogue";

    @Bean
    public CacheManager cacheManager() {
        log.info("[CACHE] Initialising Caffeine CacheManager - caches: '{}', '{}'",
                CACHE_STATIONS, CACHE_STATION_CATALOGUE);

        SimpleCacheManager manager = new SimpleCacheManager();
        manager.setCaches(List.of(
                buildCache(CACHE_STATIONS,          30, 2000),
                buildCache(CACHE_STATION_CATALOGUE, 30, 1)
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
