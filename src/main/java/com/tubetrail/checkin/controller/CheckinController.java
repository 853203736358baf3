package com.tubetrail.checkin.controller;

import com.tubetrail.checkin.dto.CheckinErrorResponse;
import com.tubetrail.checkin.dto.CheckinOutcome;
import com.tubetrail.checkin.dto.CheckinRequest;
import com.tubetrail.checkin.dto.CheckinSuccessResponse;
import com.tubetrail.checkin.service.VisitRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * CheckinController - station check-in API
 *
 *  POST /api/checkins   record a visit for (activity, station)
 *
 * Status codes:
 *  200  visit stored (verified or pending)
 *  400  missing_fields, invalid_coordinates
 *  403  forbidden (body user_id is not the caller)
 *  404  station_not_found
 *  409  duplicate_visit, duplicate_visit_race
 *  503  store_unavailable (retryable)
 */
@RestController
@RequestMapping("/api/checkins")
@RequiredArgsConstructor
@Slf4j
public class CheckinController {

    public static final String USER_HEADER = "X-User-Id";

    private final VisitRecorder visitRecorder;

    @PostMapping
    public ResponseEntity<?> checkIn(@RequestBody CheckinRequest request,
                                     @RequestHeader(value = USER_HEADER, required = false) String callerUserId) {
        CheckinOutcome outcome = visitRecorder.recordVisit(request, callerUserId);

        if (outcome.isRecorded()) {
            return ResponseEntity.ok(CheckinSuccessResponse.from(outcome.getVisit()));
        }
        return ResponseEntity.status(statusFor(outcome.getKind())).body(CheckinErrorResponse.from(outcome));
    }

    private static HttpStatus statusFor(CheckinOutcome.Kind kind) {
        switch (kind) {
            case DUPLICATE:
                return HttpStatus.CONFLICT;
            case MISSING_FIELDS:
                return HttpStatus.BAD_REQUEST;
            case STATION_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case FORBIDDEN:
                return HttpStatus.FORBIDDEN;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
