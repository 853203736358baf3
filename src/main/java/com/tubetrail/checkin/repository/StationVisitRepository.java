package com.tubetrail.checkin.repository;

import com.tubetrail.checkin.entity.StationVisit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for StationVisit.
 *
 * Writes go through VisitWriter only; nothing else inserts visits.
 */
@Repository
public interface StationVisitRepository extends JpaRepository<StationVisit, String> {

    /**
     * Looks up the visit occupying an (activity, station) slot.
     * Backed by the uk_station_visits_activity_station unique index.
     */
    Optional<StationVisit> findByActivityIdAndStationId(String activityId, String stationId);

    /** All visits of an activity in arrival order. */
    List<StationVisit> findByActivityIdOrderBySequenceNumberAsc(String activityId);

    long countByActivityId(String activityId);
}
