package com.tubetrail.checkin.controller;

import com.tubetrail.checkin.dto.ApiResponse;
import com.tubetrail.checkin.entity.StationVisit;
import com.tubetrail.checkin.repository.StationVisitRepository;
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
 * Read side for an activity's visits, in arrival order.
 *
 *  GET /api/activities/{activityId}/visits
 */
@RestController
@RequestMapping("/api/activities")
@RequiredArgsConstructor
@Slf4j
public class VisitQueryController {

    private final StationVisitRepository stationVisitRepository;

    @GetMapping("/{activityId}/visits")
    public ResponseEntity<ApiResponse> getVisits(@PathVariable String activityId) {
        log.info("VISITS API: GET visits for activity {}", activityId);
        List<StationVisit> visits = stationVisitRepository.findByActivityIdOrderBySequenceNumberAsc(activityId);
        return ResponseEntity.ok(ApiResponse.success(toResponseList(visits),
                "Found " + visits.size() + " visit(s) for activity " + activityId));
    }

    private List<Map<String, Object>> toResponseList(List<StationVisit> visits) {
        return visits.stream().map(v -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("visit_id",            v.getId());
            m.put("seq_actual",          v.getSequenceNumber());
            m.put("station_id",          v.getStationId());
            m.put("user_id",             v.getUserId());
            m.put("status",              v.getStatus().code());
            m.put("pending_reason",      v.getPendingReason() != null ? v.getPendingReason().code() : null);
            m.put("verification_method", v.getVerificationMethod().code());
            m.put("is_simulation",       v.isSimulation());
            m.put("gps_source",          v.getGpsSource().code());
            m.put("geofence_distance_m", v.getGeofenceDistanceM());
            m.put("exif_time_present",   v.isExifTimePresent());
            m.put("exif_gps_present",    v.isExifGpsPresent());
            m.put("visited_at",          v.getVisitedAt() != null ? v.getVisitedAt().toString() : null);
            return m;
        }).toList();
    }
}
