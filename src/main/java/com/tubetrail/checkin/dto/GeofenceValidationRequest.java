package com.tubetrail.checkin.dto;

import com.tubetrail.checkin.entity.GpsSource;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

/**
 * DTO for the stand-alone server-side geofence check.
 *
 * Example request body:
 * {
 *   "userLat": 51.5412, "userLng": -0.1234,
 *   "stationLat": 51.5308, "stationLng": -0.1238,
 *   "stationId": "940GZZLUKSX",
 *   "gpsSource": "device",
 *   "clientDistance": 50
 * }
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GeofenceValidationRequest {

    @NotNull(message = "userLat is required")
    private Double userLat;

    @NotNull(message = "userLng is required")
    private Double userLng;

    @NotNull(message = "stationLat is required")
    private Double stationLat;

    @NotNull(message = "stationLng is required")
    private Double stationLng;

    @NotBlank(message = "stationId is required")
    private String stationId;

    private GpsSource gpsSource;

    /** Distance the client computed itself; compared, never trusted */
    private Double clientDistance;

}
