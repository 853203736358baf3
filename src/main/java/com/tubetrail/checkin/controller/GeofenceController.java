package com.tubetrail.checkin.controller;

import com.tubetrail.checkin.dto.GeofenceValidationRequest;
import com.tubetrail.checkin.dto.GeofenceValidationResponse;
import com.tubetrail.checkin.dto.GeofenceValidationResult;
import com.tubetrail.checkin.entity.GpsSource;
import com.tubetrail.checkin.entity.Station;
import com.tubetrail.checkin.service.AuditService;
import com.tubetrail.checkin.service.GeofenceEvaluator;
import com.tubetrail.checkin.service.StationDirectory;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Stand-alone server geofence check, used by the app as a pre-flight before
 * it offers the check-in button.
 *
 *  POST /api/geofence/validate
 *
 * For a catalogue station the stored coordinates and radius are used; the
 * station coordinates in the request only matter for unknown ids.
 */
@RestController
@RequestMapping("/api/geofence")
@RequiredArgsConstructor
@Slf4j
public class GeofenceController {

    private final GeofenceEvaluator geofenceEvaluator;
    private final StationDirectory stationDirectory;
    private final AuditService auditService;
    private final Clock clock;

    @PostMapping("/validate")
    public ResponseEntity<GeofenceValidationResponse> validate(@Valid @RequestBody GeofenceValidationRequest request) {
        Optional<Station> station = stationDirectory.findStation(request.getStationId());
        double stationLat = station.map(Station::getLatitude).orElse(request.getStationLat());
        double stationLng = station.map(Station::getLongitude).orElse(request.getStationLng());
        double radius = geofenceEvaluator.radiusFor(station.orElse(null));
        GpsSource gpsSource = request.getGpsSource() != null ? request.getGpsSource() : GpsSource.NONE;

        GeofenceValidationResult result = geofenceEvaluator.evaluate(
                request.getUserLat(), request.getUserLng(), stationLat, stationLng,
                radius, gpsSource, request.getClientDistance());

        log.info("Server geofence validation - station: {}, result: {}, distance: {}m, radius: {}m, source: {}, clientMatch: {}",
                request.getStationId(), result.isValid() ? "PASS" : "FAIL", result.roundedDistance(),
                radius, gpsSource.code(), result.getClientServerMatch());

        if (result.isClientMismatch()) {
            auditService.recordGeofenceMismatch(request.getStationId(), result);
        }
        return ResponseEntity.ok(GeofenceValidationResponse.from(result, LocalDateTime.now(clock)));
    }
}
