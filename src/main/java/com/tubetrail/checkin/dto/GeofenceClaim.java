package com.tubetrail.checkin.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tubetrail.checkin.entity.GpsSource;
import lombok.*;

/**
 * Geofence outcome as computed on the device. Diagnostic only: the server
 * recomputes distance itself and never admits a visit on this claim.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GeofenceClaim {

    private Boolean withinGeofence;

    private Double distance;

    private GpsSource gpsSource;

}
