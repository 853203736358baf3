package com.tubetrail.checkin.entity;

/**
 * Trust status of a station visit.
 *
 * Terminal for a given row: a PENDING visit is never promoted in place by the
 * check-in engine. Stored as a String in the DB via @Enumerated(EnumType.STRING).
 */
public enum VisitStatus {

    VERIFIED,

    PENDING;

    /** Wire value, lower-case ("verified" / "pending"). */
    public String code() {
        return name().toLowerCase();
    }
}
