package com.tubetrail.checkin.service;

import com.tubetrail.checkin.dto.CheckinOutcome;
import com.tubetrail.checkin.dto.CheckinRequest;
import com.tubetrail.checkin.dto.DecisionInputs;
import com.tubetrail.checkin.dto.GeofenceValidationResult;
import com.tubetrail.checkin.dto.OcrClaim;
import com.tubetrail.checkin.dto.OcrResult;
import com.tubetrail.checkin.dto.StatusDecision;
import com.tubetrail.checkin.entity.GpsSource;
import com.tubetrail.checkin.entity.Station;
import com.tubetrail.checkin.entity.StationVisit;
import com.tubetrail.checkin.exception.InvalidPhotoReadException;
import com.tubetrail.checkin.util.GeofenceUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * VisitRecorder - one check-in request, start to finish.
 *
 * Flow:
 *  1. Required fields (body user_id filled from the caller) → missing_fields
 *  2. Caller identity vs body user_id         → forbidden
 *  3. Coordinates, photo-read confidence      → invalid_coordinates, invalid_ocr_result
 *  4. Lock-free duplicate pre-check           → duplicate_visit
 *  5. Station lookup                          → station_not_found
 *  6. Server geofence (EXIF first, then device)
 *  7. Photo read (only on the live, connected, AI-enabled path)
 *  8. Status decision
 *  9. Locked write via VisitWriter            → duplicate_visit_race on a lost race
 * 10. Live notification after commit
 *
 * Not @Transactional. The photo read between the pre-check and the write
 * holds no database lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VisitRecorder {

    private final DuplicateGuard duplicateGuard;
    private final StationDirectory stationDirectory;
    private final GeofenceEvaluator geofenceEvaluator;
    private final OcrService ocrService;
    private final StatusDecisionEngine statusDecisionEngine;
    private final VisitWriter visitWriter;
    private final VisitEventPublisher visitEventPublisher;
    private final Clock clock;

    /**
     * @param callerUserId identity established upstream (X-User-Id), or null
     * @throws com.tubetrail.checkin.exception.InvalidCoordinatesException   out-of-range coordinates
     * @throws InvalidPhotoReadException client photo-read confidence outside 0.0 to 1.0
     * @throws com.tubetrail.checkin.exception.VisitStoreUnavailableException store failure, retryable
     */
    public CheckinOutcome recordVisit(CheckinRequest request, String callerUserId) {
        boolean callerKnown = callerUserId != null && !callerUserId.isBlank();
        if (callerKnown && isBlank(request.getUserId())) {
            request.setUserId(callerUserId);
        }

        List<String> missing = missingFields(request);
        if (!missing.isEmpty()) {
            log.info("Check-in rejected - missing fields: {}", missing);
            return CheckinOutcome.missingFields("Missing required fields: " + String.join(", ", missing));
        }

        if (callerKnown && !request.getUserId().equals(callerUserId)) {
            log.warn("Check-in rejected - body user {} does not match caller {}", request.getUserId(), callerUserId);
            return CheckinOutcome.forbidden("You can only check in for yourself.");
        }

        String activityId = request.getActivityId();
        String stationId = request.getStationId();
        boolean simulation = request.simulationRequested();

        log.info("Check-in received - activity: {}, station: {}, user: {}, simulation: {}, ai: {}, connected: {}",
                activityId, stationId, request.getUserId(), simulation,
                request.aiRequested(), request.connectivityReported());

        if (!simulation) {
            validateCoordinates(request);
            validatePhotoClaim(request);
        }

        Optional<StationVisit> existing = duplicateGuard.findExisting(activityId, stationId);
        if (existing.isPresent()) {
            log.info("Duplicate check-in - activity: {}, station: {}, existing visit: {}",
                    activityId, stationId, existing.get().getId());
            return CheckinOutcome.duplicate(duplicateGuard.describeConflict(existing.get()), false);
        }

        Optional<Station> station = stationDirectory.findStation(stationId);
        if (station.isEmpty()) {
            log.info("Check-in rejected - unknown station {}", stationId);
            return CheckinOutcome.stationNotFound("We don't recognise that station.");
        }

        GeofenceValidationResult geofence = simulation ? null : evaluateGeofence(request, station.get());
        OcrResult ocr = simulation ? null : readPhoto(request);

        StatusDecision decision = statusDecisionEngine.decide(DecisionInputs.builder()
                .simulationMode(simulation)
                .hasConnectivity(request.connectivityReported())
                .aiEnabled(request.aiRequested())
                .geofence(geofence)
                .ocr(ocr)
                .build());

        log.info("Check-in decision - activity: {}, station: {}, status: {}, reason: {}, method: {}",
                activityId, stationId, decision.getStatus(), decision.getPendingReason(),
                decision.getVerificationMethod());

        StationVisit draft = buildVisit(request, decision, geofence, ocr, simulation);
        VisitWriter.WriteResult written = visitWriter.write(draft, geofence, ocr);

        if (!written.isRecorded()) {
            return CheckinOutcome.duplicate(duplicateGuard.describeConflict(written.getExistingVisit()), true);
        }

        visitEventPublisher.visitRecorded(written.getVisit());
        return CheckinOutcome.recorded(written.getVisit());
    }

    private static List<String> missingFields(CheckinRequest request) {
        List<String> missing = new ArrayList<>();
        if (isBlank(request.getActivityId())) {
            missing.add("activity_id");
        }
        if (isBlank(request.getStationId())) {
            missing.add("station_id");
        }
        if (isBlank(request.getUserId())) {
            missing.add("user_id");
        }
        return missing;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // A half-supplied pair is treated as absent; a supplied but out-of-range pair is rejected.
    private static void validateCoordinates(CheckinRequest request) {
        if (request.hasExifCoordinates()) {
            GeofenceUtil.requireValid(request.getLatitude(), request.getLongitude());
        }
        if (request.hasDeviceCoordinates()) {
            GeofenceUtil.requireValid(request.getVisitLat(), request.getVisitLon());
        }
    }

    private static void validatePhotoClaim(CheckinRequest request) {
        OcrClaim claim = request.getOcrResult();
        if (claim == null) {
            return;
        }
        double confidence = claim.getConfidence();
        if (!Double.isFinite(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new InvalidPhotoReadException("Photo read confidence out of range: " + confidence);
        }
    }

    private GeofenceValidationResult evaluateGeofence(CheckinRequest request, Station station) {
        double radius = geofenceEvaluator.radiusFor(station);
        Double clientDistance = request.getClientDistance();
        if (clientDistance == null && request.getGeofenceResult() != null) {
            clientDistance = request.getGeofenceResult().getDistance();
        }

        if (request.hasExifCoordinates()) {
            return geofenceEvaluator.evaluate(request.getLatitude(), request.getLongitude(),
                    station.getLatitude(), station.getLongitude(), radius, GpsSource.EXIF, clientDistance);
        }
        if (request.hasDeviceCoordinates()) {
            return geofenceEvaluator.evaluate(request.getVisitLat(), request.getVisitLon(),
                    station.getLatitude(), station.getLongitude(), radius, GpsSource.DEVICE, clientDistance);
        }
        if (request.getGeofenceResult() != null) {
            return geofenceEvaluator.withoutCoordinates(radius, clientDistance);
        }
        return null;
    }

    private OcrResult readPhoto(CheckinRequest request) {
        boolean liveRead = request.connectivityReported()
                && request.aiRequested()
                && !isBlank(request.getImage());
        if (liveRead) {
            return ocrService.verifyForStation(request.getImage(), request.getStationId());
        }

        OcrClaim claim = request.getOcrResult();
        if (claim == null) {
            return null;
        }
        return OcrResult.builder()
                .success(claim.isSuccess())
                .confidence(claim.getConfidence())
                .stationTextRaw(claim.getStationTextRaw())
                .build();
    }

    private StationVisit buildVisit(CheckinRequest request, StatusDecision decision,
                                    GeofenceValidationResult geofence, OcrResult ocr, boolean simulation) {
        StationVisit.StationVisitBuilder visit = StationVisit.builder()
                .activityId(request.getActivityId())
                .stationId(request.getStationId())
                .userId(request.getUserId())
                .status(decision.getStatus())
                .pendingReason(decision.getPendingReason())
                .verificationMethod(decision.getVerificationMethod())
                .simulation(simulation)
                .exifTimePresent(request.isExifTimePresent())
                .exifGpsPresent(request.isExifGpsPresent())
                .verificationImageUrl(request.getVerificationImageUrl())
                .capturedAt(request.getCapturedAt() != null
                        ? LocalDateTime.ofInstant(request.getCapturedAt().toInstant(), ZoneOffset.UTC)
                        : null)
                .visitedAt(LocalDateTime.now(clock))
                .gpsSource(GpsSource.NONE);

        // Simulated visits carry no location data at all.
        if (simulation) {
            return visit.build();
        }

        visit.latitude(request.getLatitude())
                .longitude(request.getLongitude())
                .visitLat(request.getVisitLat())
                .visitLon(request.getVisitLon())
                .clientDistanceM(request.getClientDistance());

        if (geofence != null) {
            visit.gpsSource(geofence.getGpsSource())
                    .geofenceDistanceM(geofence.roundedDistance() != null ? geofence.roundedDistance().doubleValue() : null)
                    .clientDistanceM(geofence.getClientDistance())
                    .clientServerMatch(geofence.getClientServerMatch());
        }
        if (ocr != null) {
            visit.aiStationText(ocr.getStationTextRaw())
                    .aiConfidence(ocr.getConfidence());
        }
        return visit.build();
    }
}
