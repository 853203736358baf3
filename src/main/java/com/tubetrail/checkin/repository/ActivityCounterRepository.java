package com.tubetrail.checkin.repository;

import com.tubetrail.checkin.entity.ActivityCounter;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for the per-activity sequence counter.
 */
@Repository
public interface ActivityCounterRepository extends JpaRepository<ActivityCounter, String> {

    /**
     * Acquires a PESSIMISTIC_WRITE (SELECT FOR UPDATE) lock on the counter row.
     *
     * Every check-in writer for the activity serializes here, so the duplicate
     * re-check and the sequence allocation that follow see all committed visits.
     * The lock wait is bounded; on expiry the store raises a lock-acquisition
     * failure which is surfaced to the caller as a retryable error.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("SELECT c FROM ActivityCounter c WHERE c.activityId = :activityId")
    Optional<ActivityCounter> findByIdForUpdate(@Param("activityId") String activityId);
}
