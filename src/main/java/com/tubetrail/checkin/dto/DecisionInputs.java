package com.tubetrail.checkin.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Everything StatusDecisionEngine looks at. Flags travel with the request;
 * nothing is read from ambient configuration.
 */
@Value
@Builder
public class DecisionInputs {

    boolean simulationMode;

    boolean hasConnectivity;

    boolean aiEnabled;

    /** null when no geofence evidence was offered */
    GeofenceValidationResult geofence;

    /** null when no photo was read */
    OcrResult ocr;

}
