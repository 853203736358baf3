package com.tubetrail.checkin.entity;

/**
 * Audit event types written to the visit_audit_events table.
 *
 * Stored as a String in the DB via @Enumerated(EnumType.STRING).
 */
public enum VisitAuditEventType {

    /** Visit persisted with status VERIFIED */
    VISIT_VERIFIED,

    /** Visit persisted with status PENDING (reason in the detail column) */
    VISIT_PENDING,

    /** Client-reported distance disagreed with the server's haversine distance */
    CLIENT_DISTANCE_MISMATCH,

    /** Photo reader was unreachable, timed out or answered garbage */
    OCR_UNAVAILABLE
}
