package com.tubetrail.checkin.controller;

import com.tubetrail.checkin.dto.ApiResponse;
import com.tubetrail.checkin.entity.VisitAuditEvent;
import com.tubetrail.checkin.service.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AuditController - verification audit trail
 *
 * Used for dispute handling ("why is my visit pending?") and for spotting
 * clients whose distance claims disagree with the server.
 * All timestamps are server-generated.
 *
 * Endpoints:
 *  GET /api/audit/activity/{activityId}   every event for an activity
 *  GET /api/audit/visit/{visitId}         events for one stored visit
 */
@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
@Slf4j
public class AuditController {

    private final AuditService auditService;

    /**
     * @return ordered list of audit events (oldest first)
     */
    @GetMapping("/activity/{activityId}")
    public ResponseEntity<ApiResponse> getEventsByActivity(@PathVariable String activityId) {
        log.info("AUDIT API: GET events for activity {}", activityId);
        List<VisitAuditEvent> events = auditService.getEventsByActivityId(activityId);
        return ResponseEntity.ok(ApiResponse.success(toResponseList(events),
                "Found " + events.size() + " audit event(s) for activity " + activityId));
    }

    @GetMapping("/visit/{visitId}")
    public ResponseEntity<ApiResponse> getEventsByVisit(@PathVariable String visitId) {
        log.info("AUDIT API: GET events for visit {}", visitId);
        List<VisitAuditEvent> events = auditService.getEventsByVisitId(visitId);
        return ResponseEntity.ok(ApiResponse.success(toResponseList(events),
                "Found " + events.size() + " audit event(s) for visit " + visitId));
    }

    /**
     * Separates eventTimestamp (when it happened) from createdAt (when the row was written).
     */
    private List<Map<String, Object>> toResponseList(List<VisitAuditEvent> events) {
        return events.stream().map(e -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("id",             e.getId());
            m.put("activityId",     e.getActivityId());
            m.put("stationId",      e.getStationId());
            m.put("visitId",        e.getVisitId());
            m.put("eventType",      e.getEventType().name());
            m.put("detail",         e.getDetail());
            m.put("eventTimestamp", e.getTimestamp() != null ? e.getTimestamp().toString() : null);
            m.put("createdAt",      e.getCreatedAt() != null ? e.getCreatedAt().toString() : null);
            return m;
        }).toList();
    }
}
