package com.tubetrail.checkin.repository;

import com.tubetrail.checkin.entity.Station;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository interface for the station catalogue
 */
@Repository
public interface StationRepository extends JpaRepository<Station, String> {
}
