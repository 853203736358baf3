package com.tubetrail.checkin.repository;

import com.tubetrail.checkin.entity.VisitAuditEvent;
import com.tubetrail.checkin.entity.VisitAuditEventType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for VisitAuditEvent - audit trail queries.
 */
@Repository
public interface VisitAuditEventRepository extends JpaRepository<VisitAuditEvent, Long> {

    /** All events for an activity, oldest first. */
    List<VisitAuditEvent> findByActivityIdOrderByTimestampAsc(String activityId);

    /** All events attached to one stored visit, oldest first. */
    List<VisitAuditEvent> findByVisitIdOrderByTimestampAsc(String visitId);

    boolean existsByVisitIdAndEventType(String visitId, VisitAuditEventType eventType);
}
