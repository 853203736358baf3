package com.tubetrail.checkin.controller;

import com.tubetrail.checkin.config.CheckinProperties;
import com.tubetrail.checkin.dto.GeofenceValidationResult;
import com.tubetrail.checkin.entity.Station;
import com.tubetrail.checkin.service.AuditService;
import com.tubetrail.checkin.service.GeofenceEvaluator;
import com.tubetrail.checkin.service.StationDirectory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.hamcrest.Matchers.closeTo;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Wire-level tests for POST /api/geofence/validate.
 */
@WebMvcTest(GeofenceController.class)
@Import({GeofenceEvaluator.class, GeofenceControllerTest.FixedClock.class})
class GeofenceControllerTest {

    @TestConfiguration
    @EnableConfigurationProperties(CheckinProperties.class)
    static class FixedClock {
        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2026-03-01T09:30:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean private StationDirectory stationDirectory;
    @MockBean private AuditService     auditService;

    /** User ~1100 m north of King's Cross, client claiming 50 m */
    private static final String SPOOFED = "{"
            + "\"userLat\":51.54069,\"userLng\":-0.1238,"
            + "\"stationLat\":51.5308,\"stationLng\":-0.1238,"
            + "\"stationId\":\"UNKNOWN-1\",\"gpsSource\":\"device\",\"clientDistance\":50"
            + "}";

    @Test
    @DisplayName("1100 m away with radius 750 and a 50 m claim: invalid, mismatch flagged and audited")
    void spoofedDistance_rejected() throws Exception {
        mockMvc.perform(post("/api/geofence/validate").contentType(MediaType.APPLICATION_JSON).content(SPOOFED))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.distance", closeTo(1100.0, 5.0), Double.class))
                .andExpect(jsonPath("$.radiusUsed").value(750.0))
                .andExpect(jsonPath("$.gpsSource").value("device"))
                .andExpect(jsonPath("$.serverCalculation").value(true))
                .andExpect(jsonPath("$.clientServerMatch").value(false))
                .andExpect(jsonPath("$.timestamp").value("2026-03-01T09:30:00"));

        verify(auditService).recordGeofenceMismatch(eq("UNKNOWN-1"), any(GeofenceValidationResult.class));
    }

    @Test
    @DisplayName("Catalogue station coordinates and radius override the request")
    void catalogueStation_usesStoredCoordinates() throws Exception {
        when(stationDirectory.findStation("940GZZLUKSX")).thenReturn(Optional.of(Station.builder()
                .id("940GZZLUKSX").name("King's Cross St. Pancras")
                .latitude(51.54069).longitude(-0.1238).radiusMeters(100.0).build()));

        String body = "{\"userLat\":51.54069,\"userLng\":-0.1238,\"stationLat\":0.0,\"stationLng\":0.0,"
                + "\"stationId\":\"940GZZLUKSX\",\"gpsSource\":\"exif\"}";

        mockMvc.perform(post("/api/geofence/validate").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.distance").value(0))
                .andExpect(jsonPath("$.radiusUsed").value(100.0))
                .andExpect(jsonPath("$.clientServerMatch").doesNotExist());

        verifyNoInteractions(auditService);
    }

    @Test
    @DisplayName("Missing coordinates are a 400, not a crash")
    void missingCoordinates_badRequest() throws Exception {
        mockMvc.perform(post("/api/geofence/validate").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userLat\":51.5,\"stationId\":\"940GZZLUKSX\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("validation_failed"));
    }

    @Test
    @DisplayName("Non-numeric coordinates are a 400")
    void nonNumericCoordinates_badRequest() throws Exception {
        mockMvc.perform(post("/api/geofence/validate").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userLat\":\"north\",\"userLng\":0,\"stationLat\":0,\"stationLng\":0,\"stationId\":\"S\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Out-of-range latitude is invalid_coordinates")
    void outOfRange_invalidCoordinates() throws Exception {
        mockMvc.perform(post("/api/geofence/validate").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userLat\":95,\"userLng\":0,\"stationLat\":0,\"stationLng\":0,\"stationId\":\"S\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("invalid_coordinates"));
    }
}
