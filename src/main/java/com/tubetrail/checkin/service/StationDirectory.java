package com.tubetrail.checkin.service;

import com.tubetrail.checkin.config.CacheConfig;
import com.tubetrail.checkin.entity.Station;
import com.tubetrail.checkin.repository.StationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.cache.annotation.Caching;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Cached read access to the station catalogue.
 *
 * Kept as its own bean so that callers always go through the cache proxy;
 * self-calls inside one bean would skip @Cacheable.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StationDirectory {

    private final StationRepository stationRepository;

    /**
     * Single station by id. Misses are not cached, so a station added after
     * startup becomes visible on the next lookup.
     */
    @Cacheable(value = CacheConfig.CACHE_STATIONS, unless = "#result == null")
    public Optional<Station> findStation(String stationId) {
        log.debug("[CACHE MISS] station {} - loading from DB", stationId);
        return stationRepository.findById(stationId);
    }

    /** Whole catalogue, for photo-to-station name matching. */
    @Cacheable(value = CacheConfig.CACHE_STATION_CATALOGUE, key = "'all'")
    public List<Station> catalogue() {
        log.debug("[CACHE MISS] station catalogue - loading from DB");
        return stationRepository.findAll();
    }

    @Caching(evict = {
            @CacheEvict(value = CacheConfig.CACHE_STATIONS, allEntries = true),
            @CacheEvict(value = CacheConfig.CACHE_STATION_CATALOGUE, allEntries = true)
    })
    public void evictAll() {
        log.info("[CACHE EVICT] Station caches cleared");
    }
}
