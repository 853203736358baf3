package com.tubetrail.checkin.controller;

import com.tubetrail.checkin.dto.CheckinOutcome;
import com.tubetrail.checkin.dto.CheckinRequest;
import com.tubetrail.checkin.dto.DuplicateConflict;
import com.tubetrail.checkin.entity.GpsSource;
import com.tubetrail.checkin.entity.PendingReason;
import com.tubetrail.checkin.entity.StationVisit;
import com.tubetrail.checkin.entity.VerificationMethod;
import com.tubetrail.checkin.entity.VisitStatus;
import com.tubetrail.checkin.exception.InvalidPhotoReadException;
import com.tubetrail.checkin.exception.VisitStoreUnavailableException;
import com.tubetrail.checkin.service.VisitRecorder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.*;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Wire-level tests for POST /api/checkins: snake_case in, status codes and
 * envelopes out.
 */
@WebMvcTest(CheckinController.class)
class CheckinControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private VisitRecorder visitRecorder;

    private static final String BODY = "{"
            + "\"activity_id\":\"A1\",\"station_id\":\"940GZZLUKSX\",\"user_id\":\"user-1\","
            + "\"simulation_mode\":false,\"ai_enabled\":true,\"has_connectivity\":true,"
            + "\"geofence_result\":{\"within_geofence\":true,\"distance\":42.5,\"gps_source\":\"exif\"},"
            + "\"ocr_result\":{\"success\":true,\"confidence\":0.91,\"station_text_raw\":\"KING'S CROSS\"},"
            + "\"client_distance\":42.5,"
            + "\"visit_lat\":51.5309,\"visit_lon\":-0.1239,"
            + "\"exif_time_present\":true,\"exif_gps_present\":false"
            + "}";

    private static StationVisit storedVisit(VisitStatus status, PendingReason reason, VerificationMethod method) {
        return StationVisit.builder()
                .id("visit-9")
                .activityId("A1")
                .stationId("940GZZLUKSX")
                .userId("user-1")
                .sequenceNumber(3)
                .status(status)
                .pendingReason(reason)
                .verificationMethod(method)
                .gpsSource(GpsSource.DEVICE)
                .build();
    }

    @Test
    @DisplayName("Request is read as snake_case and the caller header is passed on")
    void requestMapping() throws Exception {
        when(visitRecorder.recordVisit(any(), any())).thenReturn(CheckinOutcome.recorded(
                storedVisit(VisitStatus.VERIFIED, null, VerificationMethod.AI_IMAGE)));

        mockMvc.perform(post("/api/checkins")
                        .header(CheckinController.USER_HEADER, "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isOk());

        ArgumentCaptor<CheckinRequest> captor = ArgumentCaptor.forClass(CheckinRequest.class);
        verify(visitRecorder).recordVisit(captor.capture(), eq("user-1"));
        CheckinRequest request = captor.getValue();
        assertThat(request.getActivityId()).isEqualTo("A1");
        assertThat(request.getStationId()).isEqualTo("940GZZLUKSX");
        assertThat(request.simulationRequested()).isFalse();
        assertThat(request.getGeofenceResult().getGpsSource()).isEqualTo(GpsSource.EXIF);
        assertThat(request.getOcrResult().getConfidence()).isEqualTo(0.91);
        assertThat(request.getVisitLat()).isEqualTo(51.5309);
        assertThat(request.isExifTimePresent()).isTrue();
    }

    @Test
    @DisplayName("Stored visit: 200 with visit_id, seq_actual and status")
    void recorded_ok() throws Exception {
        when(visitRecorder.recordVisit(any(), any())).thenReturn(CheckinOutcome.recorded(
                storedVisit(VisitStatus.PENDING, PendingReason.OCR_FAILED, VerificationMethod.AI_IMAGE)));

        mockMvc.perform(post("/api/checkins").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.visit_id").value("visit-9"))
                .andExpect(jsonPath("$.seq_actual").value(3))
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.pending_reason").value("ocr_failed"))
                .andExpect(jsonPath("$.verification_method").value("ai_image"));
    }

    @Test
    @DisplayName("Duplicate: 409 with context and no visit id")
    void duplicate_conflict() throws Exception {
        DuplicateConflict conflict = DuplicateConflict.builder()
                .existingVisitId("visit-1")
                .stationName("King's Cross St. Pancras")
                .visitedAt(LocalDateTime.of(2026, 3, 1, 9, 0))
                .build();
        when(visitRecorder.recordVisit(any(), any())).thenReturn(CheckinOutcome.duplicate(conflict, false));

        mockMvc.perform(post("/api/checkins").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.data").value(nullValue()))
                .andExpect(jsonPath("$.visit_id").doesNotExist())
                .andExpect(jsonPath("$.seq_actual").doesNotExist())
                .andExpect(jsonPath("$.error.code").value("duplicate_visit"))
                .andExpect(jsonPath("$.error.message").value("Already checked in to King's Cross St. Pancras for this activity."))
                .andExpect(jsonPath("$.error.duplicate.existing_visit_id").value("visit-1"))
                .andExpect(jsonPath("$.error.duplicate.station_name").value("King's Cross St. Pancras"))
                .andExpect(jsonPath("$.error.duplicate.visited_at").value("2026-03-01T09:00:00"));
    }

    @Test
    @DisplayName("Missing fields: 400 missing_fields")
    void missingFields_badRequest() throws Exception {
        when(visitRecorder.recordVisit(any(), any()))
                .thenReturn(CheckinOutcome.missingFields("Missing required fields: activity_id"));

        mockMvc.perform(post("/api/checkins").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("missing_fields"));
    }

    @Test
    @DisplayName("Forbidden and unknown station map to 403 and 404")
    void forbiddenAndNotFound() throws Exception {
        when(visitRecorder.recordVisit(any(), any()))
                .thenReturn(CheckinOutcome.forbidden("no"))
                .thenReturn(CheckinOutcome.stationNotFound("no"));

        mockMvc.perform(post("/api/checkins").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.code").value("forbidden"));
        mockMvc.perform(post("/api/checkins").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("station_not_found"));
    }

    @Test
    @DisplayName("Store outage: 503, retryable")
    void storeUnavailable_retryable() throws Exception {
        when(visitRecorder.recordVisit(any(), any())).thenThrow(new VisitStoreUnavailableException("down"));

        mockMvc.perform(post("/api/checkins").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error.code").value("store_unavailable"))
                .andExpect(jsonPath("$.error.retryable").value(true));
    }

    @Test
    @DisplayName("Photo read confidence out of range: 400 invalid_ocr_result")
    void invalidPhotoRead_badRequest() throws Exception {
        when(visitRecorder.recordVisit(any(), any()))
                .thenThrow(new InvalidPhotoReadException("Photo read confidence out of range: 42.0"));

        mockMvc.perform(post("/api/checkins").contentType(MediaType.APPLICATION_JSON)
                        .content(BODY.replace("\"confidence\":0.91", "\"confidence\":42.0")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("invalid_ocr_result"))
                .andExpect(jsonPath("$.error.retryable").doesNotExist());
    }
}
