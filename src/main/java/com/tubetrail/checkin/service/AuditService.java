package com.tubetrail.checkin.service;

import com.tubetrail.checkin.dto.GeofenceValidationResult;
import com.tubetrail.checkin.dto.OcrResult;
import com.tubetrail.checkin.entity.StationVisit;
import com.tubetrail.checkin.entity.VisitAuditEvent;
import com.tubetrail.checkin.entity.VisitAuditEventType;
import com.tubetrail.checkin.entity.VisitStatus;
import com.tubetrail.checkin.repository.VisitAuditEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * AuditService - verification audit trail.
 *
 * Write side: called from inside the visit write transaction, so a visit and
 * its audit rows commit together. Timestamps are server time only.
 * Read side: queries for the audit endpoints.
 *
 * Nothing is written for duplicate attempts; a rejected check-in leaves no
 * trace in the store beyond the log.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditService {

    private final VisitAuditEventRepository auditEventRepository;
    private final Clock clock;

    /**
     * Records the outcome of a stored visit plus any anomalies seen on the way:
     * a client/server distance disagreement, an unreachable photo reader.
     */
    @Transactional
    public void recordVisit(StationVisit visit, GeofenceValidationResult geofence, OcrResult ocr) {
        VisitAuditEventType outcome = visit.getStatus() == VisitStatus.VERIFIED
                ? VisitAuditEventType.VISIT_VERIFIED
                : VisitAuditEventType.VISIT_PENDING;
        String detail = "method=" + visit.getVerificationMethod().code()
                + (visit.getPendingReason() != null ? ",reason=" + visit.getPendingReason().code() : "")
                + ",seq=" + visit.getSequenceNumber()
                + (visit.isSimulation() ? ",simulation=true" : "");
        save(visit, outcome, detail);

        if (geofence != null && geofence.isClientMismatch() && !visit.isSimulation()) {
            save(visit, VisitAuditEventType.CLIENT_DISTANCE_MISMATCH, mismatchDetail(geofence));
        }
        if (ocr != null && ocr.isUnavailable()) {
            save(visit, VisitAuditEventType.OCR_UNAVAILABLE, "error=" + ocr.getErrorCode());
        }
    }

    /**
     * Mismatch seen by the stand-alone geofence endpoint, where no visit exists.
     */
    @Transactional
    public void recordGeofenceMismatch(String stationId, GeofenceValidationResult geofence) {
        persist(VisitAuditEvent.builder()
                .stationId(stationId)
                .eventType(VisitAuditEventType.CLIENT_DISTANCE_MISMATCH)
                .detail(mismatchDetail(geofence))
                .timestamp(LocalDateTime.now(clock))
                .build());
    }

    /**
     * All audit events for an activity, oldest first.
     */
    @Transactional(readOnly = true)
    public List<VisitAuditEvent> getEventsByActivityId(String activityId) {
        log.debug("AUDIT: Querying events for activity {}", activityId);
        List<VisitAuditEvent> events = auditEventRepository.findByActivityIdOrderByTimestampAsc(activityId);
        log.info("AUDIT: Found {} event(s) for activity {}", events.size(), activityId);
        return events;
    }

    /**
     * All audit events for one stored visit, oldest first.
     */
    @Transactional(readOnly = true)
    public List<VisitAuditEvent> getEventsByVisitId(String visitId) {
        log.debug("AUDIT: Querying events for visit {}", visitId);
        return auditEventRepository.findByVisitIdOrderByTimestampAsc(visitId);
    }

    private void save(StationVisit visit, VisitAuditEventType type, String detail) {
        persist(VisitAuditEvent.builder()
                .activityId(visit.getActivityId())
                .stationId(visit.getStationId())
                .userId(visit.getUserId())
                .visitId(visit.getId())
                .eventType(type)
                .detail(detail)
                .timestamp(LocalDateTime.now(clock))
                .build());
    }

    private void persist(VisitAuditEvent event) {
        auditEventRepository.save(event);
        log.info("AUDIT: {} persisted - activity: {}, station: {}, visit: {}, {}",
                event.getEventType(), event.getActivityId(), event.getStationId(),
                event.getVisitId(), event.getDetail());
    }

    private static String mismatchDetail(GeofenceValidationResult geofence) {
        return String.format("client=%.1f,server=%.1f,source=%s",
                geofence.getClientDistance(), geofence.getDistance(), geofence.getGpsSource().code());
    }
}
