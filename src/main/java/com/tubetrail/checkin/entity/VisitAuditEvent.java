package com.tubetrail.checkin.entity;

import jakarta.persistence.*;
import lombok.*;
import java.time.LocalDateTime;

/**
 * Audit trail for check-in verification.
 *
 * Fields:
 *  - activityId / stationId / userId : which check-in the event belongs to
 *  - visitId                         : null for events not tied to a stored visit
 *  - eventType                       : typed enum (VisitAuditEventType)
 *  - detail                          : short machine-readable context (reason code, distances)
 *  - timestamp                       : SERVER time when the event was evaluated
 *  - createdAt                       : SERVER time when the row was written
 */
@Entity
@Table(
    name = "visit_audit_events",
    indexes = {
        @Index(name = "idx_visit_audit_activity_id", columnList = "activity_id"),
        @Index(name = "idx_visit_audit_visit_id",    columnList = "visit_id")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VisitAuditEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "activity_id")
    private String activityId;

    @Column(name = "station_id")
    private String stationId;

    @Column(name = "user_id")
    private String userId;

    @Column(name = "visit_id", length = 36)
    private String visitId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 32)
    private VisitAuditEventType eventType;

    @Column(length = 512)
    private String detail;

    @Column(name = "event_timestamp", nullable = false)
    private LocalDateTime timestamp;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }
}
