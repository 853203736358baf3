package com.tubetrail.checkin.dto;

import com.tubetrail.checkin.entity.GpsSource;
import lombok.Builder;
import lombok.Value;

/**
 * Server-side geofence outcome. Not persisted as its own entity.
 *
 * valid is derived from the server-computed distance only; clientDistance
 * and clientServerMatch are carried for auditing.
 */
@Value
@Builder
public class GeofenceValidationResult {

    /** Server haversine distance in meters; null when no coordinates were available */
    Double distance;

    double radiusUsed;

    boolean valid;

    GpsSource gpsSource;

    Double clientDistance;

    /** null when the client sent no distance of its own */
    Boolean clientServerMatch;

    public Long roundedDistance() {
        return distance == null ? null : Math.round(distance);
    }

    public boolean isClientMismatch() {
        return Boolean.FALSE.equals(clientServerMatch);
    }
}
