package com.tubetrail.checkin.config;

import com.tubetrail.checkin.entity.Station;
import com.tubetrail.checkin.repository.StationRepository;
import com.tubetrail.checkin.service.StationDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Data loader that runs on application startup.
 * Inserts a small London Underground station catalogue when the stations
 * table is empty and checkin.seed.enabled is true.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DataLoader implements CommandLineRunner {

    private final StationRepository stationRepository;
    private final StationDirectory stationDirectory;
    private final CheckinProperties properties;

    @Override
    public void run(String... args) {
        if (!properties.getSeed().isEnabled()) {
            log.info("Station seeding disabled");
            return;
        }

        // Check if data already exists to avoid duplicates
        if (stationRepository.count() > 0) {
            log.info("Station catalogue already present, skipping initialization");
            return;
        }

        List<Station> stations = List.of(
                station("940GZZLUKSX", "King's Cross St. Pancras", 51.5308, -0.1238),
                station("940GZZLUEUS", "Euston", 51.5282, -0.1337),
                station("940GZZLUBND", "Bond Street", 51.5142, -0.1494),
                station("940GZZLUOXC", "Oxford Circus", 51.5152, -0.1419),
                station("940GZZLUGPK", "Green Park", 51.5067, -0.1428),
                station("940GZZLUWLO", "Waterloo", 51.5036, -0.1143),
                station("940GZZLUBNK", "Bank", 51.5133, -0.0886),
                station("940GZZLULVT", "Liverpool Street", 51.5178, -0.0823),
                station("940GZZLUPAC", "Paddington", 51.5154, -0.1755),
                station("940GZZLUWSM", "Westminster", 51.5010, -0.1254),
                station("940GZZLUHSC", "Hammersmith (H&C Line)", 51.4936, -0.2251),
                station("940GZZLUEAC", "Elephant & Castle", 51.4943, -0.1001)
        );
        stationRepository.saveAll(stations);
        stationDirectory.evictAll();
        log.info("Station catalogue seeded: {} stations", stations.size());
    }

    private static Station station(String id, String name, double latitude, double longitude) {
        return Station.builder()
                .id(id)
                .name(name)
                .latitude(latitude)
                .longitude(longitude)
                .build();
    }
}
