package com.tubetrail.checkin.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tubetrail.checkin.entity.GpsSource;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Response of POST /api/geofence/validate.
 * clientServerMatch is omitted when the request carried no clientDistance.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GeofenceValidationResponse {

    boolean valid;

    long distance;

    double radiusUsed;

    GpsSource gpsSource;

    @Builder.Default
    boolean serverCalculation = true;

    Boolean clientServerMatch;

    LocalDateTime timestamp;

    public static GeofenceValidationResponse from(GeofenceValidationResult result, LocalDateTime timestamp) {
        return GeofenceValidationResponse.builder()
                .valid(result.isValid())
                .distance(result.roundedDistance() != null ? result.roundedDistance() : 0L)
                .radiusUsed(result.getRadiusUsed())
                .gpsSource(result.getGpsSource())
                .clientServerMatch(result.getClientServerMatch())
                .timestamp(timestamp)
                .build();
    }
}
