package com.tubetrail.checkin.entity;

/**
 * Why a visit was accepted as PENDING instead of VERIFIED.
 * Only ever populated alongside {@link VisitStatus#PENDING}.
 */
public enum PendingReason {

    /** Device reported no network at check-in time */
    NO_CONNECTIVITY,

    /** AI photo verification switched off for this check-in */
    AI_DISABLED,

    /** Server-computed distance is outside the station radius */
    GEOFENCE_FAILED,

    /** No usable coordinates were supplied at all */
    NO_GPS_DATA,

    /** Photo reader failed, timed out or was unreachable */
    OCR_FAILED,

    /** Photo was read but below the confidence threshold */
    LOW_CONFIDENCE;

    public String code() {
        return name().toLowerCase();
    }
}
