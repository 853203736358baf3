package com.tubetrail.checkin.service;

import com.tubetrail.checkin.dto.DecisionInputs;
import com.tubetrail.checkin.dto.GeofenceValidationResult;
import com.tubetrail.checkin.dto.OcrResult;
import com.tubetrail.checkin.dto.StatusDecision;
import com.tubetrail.checkin.entity.GpsSource;
import com.tubetrail.checkin.entity.PendingReason;
import com.tubetrail.checkin.entity.VerificationMethod;
import org.springframework.stereotype.Component;

/**
 * Turns check-in evidence into (status, pendingReason, verificationMethod).
 *
 * Strict priority chain; the first matching rule wins:
 * <ol>
 *   <li>simulation            → verified / simulation</li>
 *   <li>no connectivity       → pending no_connectivity / offline</li>
 *   <li>AI disabled           → pending ai_disabled / manual</li>
 *   <li>geofence invalid, no GPS → pending no_gps_data / ai_image</li>
 *   <li>geofence invalid      → pending geofence_failed / ai_image</li>
 *   <li>photo read failed     → pending ocr_failed / ai_image</li>
 *   <li>confidence &lt; 0.7   → pending low_confidence / ai_image</li>
 *   <li>otherwise             → verified / ai_image if a photo was read, else gps</li>
 * </ol>
 * Geofence is judged before the photo: a good read taken at the wrong place
 * is the more dangerous one to trust.
 *
 * Pure: no clock, no randomness, no configuration lookups.
 */
@Component
public class StatusDecisionEngine {

    public static final double MIN_OCR_CONFIDENCE = 0.7;

    public StatusDecision decide(DecisionInputs inputs) {
        if (inputs.isSimulationMode()) {
            return StatusDecision.verified(VerificationMethod.SIMULATION);
        }
        if (!inputs.isHasConnectivity()) {
            return StatusDecision.pending(PendingReason.NO_CONNECTIVITY, VerificationMethod.OFFLINE);
        }
        if (!inputs.isAiEnabled()) {
            return StatusDecision.pending(PendingReason.AI_DISABLED, VerificationMethod.MANUAL);
        }

        GeofenceValidationResult geofence = inputs.getGeofence();
        if (geofence != null && !geofence.isValid()) {
            PendingReason reason = geofence.getGpsSource() == null || geofence.getGpsSource() == GpsSource.NONE
                    ? PendingReason.NO_GPS_DATA
                    : PendingReason.GEOFENCE_FAILED;
            return StatusDecision.pending(reason, VerificationMethod.AI_IMAGE);
        }

        OcrResult ocr = inputs.getOcr();
        if (ocr != null && !ocr.isSuccess()) {
            return StatusDecision.pending(PendingReason.OCR_FAILED, VerificationMethod.AI_IMAGE);
        }
        if (ocr != null && ocr.getConfidence() < MIN_OCR_CONFIDENCE) {
            return StatusDecision.pending(PendingReason.LOW_CONFIDENCE, VerificationMethod.AI_IMAGE);
        }

        return StatusDecision.verified(ocr != null ? VerificationMethod.AI_IMAGE : VerificationMethod.GPS);
    }
}
