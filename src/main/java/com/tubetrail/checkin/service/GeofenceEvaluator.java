package com.tubetrail.checkin.service;

import com.tubetrail.checkin.config.CheckinProperties;
import com.tubetrail.checkin.dto.GeofenceValidationResult;
import com.tubetrail.checkin.entity.GpsSource;
import com.tubetrail.checkin.entity.Station;
import com.tubetrail.checkin.util.GeofenceUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Server-side geofence evaluation.
 *
 * valid is always derived from the server's own haversine distance. A
 * client-supplied distance is only compared against it (clientServerMatch)
 * and logged; no code path here admits a visit on the client's number.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GeofenceEvaluator {

    private final CheckinProperties properties;

    /**
     * @param clientDistance distance the caller computed, or null
     * @throws com.tubetrail.checkin.exception.InvalidCoordinatesException on out-of-range input
     */
    public GeofenceValidationResult evaluate(double userLat, double userLng,
                                             double stationLat, double stationLng,
                                             double radiusMeters, GpsSource gpsSource,
                                             Double clientDistance) {
        double distance = GeofenceUtil.calculateDistance(userLat, userLng, stationLat, stationLng);
        boolean valid = distance <= radiusMeters;

        Boolean clientServerMatch = null;
        if (clientDistance != null) {
            double difference = Math.abs(distance - clientDistance);
            clientServerMatch = difference <= properties.getGeofence().getClientToleranceMeters();
            if (!clientServerMatch) {
                log.warn("Geofence calculation mismatch - client: {}m, server: {}m, diff: {}m, source: {}",
                        String.format("%.1f", clientDistance), String.format("%.1f", distance),
                        String.format("%.1f", difference), gpsSource);
            }
        }

        return GeofenceValidationResult.builder()
                .distance(distance)
                .radiusUsed(radiusMeters)
                .valid(valid)
                .gpsSource(gpsSource)
                .clientDistance(clientDistance)
                .clientServerMatch(clientServerMatch)
                .build();
    }

    /**
     * Geofence evidence was offered but the server has no coordinates to check.
     * Reads as "no GPS data" in the status decision.
     */
    public GeofenceValidationResult withoutCoordinates(double radiusMeters, Double clientDistance) {
        return GeofenceValidationResult.builder()
                .distance(null)
                .radiusUsed(radiusMeters)
                .valid(false)
                .gpsSource(GpsSource.NONE)
                .clientDistance(clientDistance)
                .clientServerMatch(null)
                .build();
    }

    /** Station override when present, else the configured default. */
    public double radiusFor(Station station) {
        if (station != null && station.getRadiusMeters() != null && station.getRadiusMeters() > 0) {
            return station.getRadiusMeters();
        }
        return properties.getGeofence().getDefaultRadiusMeters();
    }
}
