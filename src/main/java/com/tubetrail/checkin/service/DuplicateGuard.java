package com.tubetrail.checkin.service;

import com.tubetrail.checkin.dto.DuplicateConflict;
import com.tubetrail.checkin.entity.ActivityCounter;
import com.tubetrail.checkin.entity.Station;
import com.tubetrail.checkin.entity.StationVisit;
import com.tubetrail.checkin.exception.VisitStoreUnavailableException;
import com.tubetrail.checkin.repository.ActivityCounterRepository;
import com.tubetrail.checkin.repository.StationVisitRepository;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

/**
 * At most one visit per (activity, station).
 *
 * Two layers:
 *  1. Every writer for an activity locks that activity's counter row
 *     (SELECT ... FOR UPDATE) and re-checks for an existing visit while
 *     holding the lock. Writers for the same activity therefore run one at
 *     a time through the check-and-insert window.
 *  2. The uk_station_visits_activity_station unique constraint rejects any
 *     insert that still slips through; VisitWriter reports it as a race.
 *
 * Visits to different stations, or to the same station in different
 * activities, never conflict.
 */
@Component
@Slf4j
public class DuplicateGuard {

    private final StationVisitRepository stationVisitRepository;
    private final ActivityCounterRepository activityCounterRepository;
    private final StationDirectory stationDirectory;
    private final TransactionTemplate counterCreation;

    public DuplicateGuard(StationVisitRepository stationVisitRepository,
                          ActivityCounterRepository activityCounterRepository,
                          StationDirectory stationDirectory,
                          PlatformTransactionManager transactionManager) {
        this.stationVisitRepository = stationVisitRepository;
        this.activityCounterRepository = activityCounterRepository;
        this.stationDirectory = stationDirectory;
        this.counterCreation = new TransactionTemplate(transactionManager);
        this.counterCreation.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Lock-free pre-check, used to turn away plain repeats before any
     * geofence or photo work is done. A miss here proves nothing under
     * concurrency; {@link #tryReserve} is the authoritative check.
     */
    @Transactional(readOnly = true)
    public Optional<StationVisit> findExisting(String activityId, String stationId) {
        return stationVisitRepository.findByActivityIdAndStationId(activityId, stationId);
    }

    /**
     * Makes sure the activity's counter row exists, in its own short
     * transaction. Two first check-ins of a new activity may both try to
     * create it; the loser's failed insert is expected and ignored.
     */
    public void ensureCounter(String activityId) {
        if (activityCounterRepository.existsById(activityId)) {
            return;
        }
        try {
            counterCreation.executeWithoutResult(status -> {
                if (!activityCounterRepository.existsById(activityId)) {
                    activityCounterRepository.saveAndFlush(ActivityCounter.builder()
                            .activityId(activityId)
                            .lastSequence(0)
                            .build());
                    log.debug("Counter created for activity {}", activityId);
                }
            });
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            log.debug("Counter for activity {} created concurrently - {}", activityId, e.getMessage());
        }
    }

    /**
     * Authoritative reservation. Must run inside the visit write transaction:
     * the counter lock taken here is held until that transaction ends.
     *
     * @return RESERVED with the locked counter, or ALREADY_EXISTS with the
     *         visit that won (always flagged as detected mid-race, since the
     *         pre-check had not seen it)
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public ReservationResult tryReserve(String activityId, String stationId) {
        ActivityCounter counter = activityCounterRepository.findByIdForUpdate(activityId)
                .orElseThrow(() -> new VisitStoreUnavailableException(
                        "Sequence counter missing for activity " + activityId));

        Optional<StationVisit> existing = stationVisitRepository.findByActivityIdAndStationId(activityId, stationId);
        if (existing.isPresent()) {
            log.info("Duplicate detected under activity lock - activity: {}, station: {}, existing visit: {}",
                    activityId, stationId, existing.get().getId());
            return ReservationResult.alreadyExists(existing.get());
        }
        return ReservationResult.reserved(counter);
    }

    /**
     * Builds the user-facing conflict context. The station name is looked up
     * here; if the lookup fails for any reason the raw station id is used so
     * the duplicate response is still returned.
     */
    public DuplicateConflict describeConflict(StationVisit existing) {
        return DuplicateConflict.builder()
                .existingVisitId(existing.getId())
                .stationName(resolveStationName(existing.getStationId()))
                .visitedAt(existing.getVisitedAt())
                .build();
    }

    String resolveStationName(String stationId) {
        try {
            return stationDirectory.findStation(stationId)
                    .map(Station::getName)
                    .filter(name -> !name.isBlank())
                    .orElse(stationId);
        } catch (RuntimeException e) {
            log.warn("Station name lookup failed for {} - falling back to id: {}", stationId, e.getMessage());
            return stationId;
        }
    }

    /**
     * Outcome of {@link #tryReserve}.
     */
    @Getter
    @AllArgsConstructor(access = AccessLevel.PRIVATE)
    public static class ReservationResult {

        private final ActivityCounter counter;
        private final StationVisit existingVisit;

        static ReservationResult reserved(ActivityCounter counter) {
            return new ReservationResult(counter, null);
        }

        static ReservationResult alreadyExists(StationVisit existingVisit) {
            return new ReservationResult(null, existingVisit);
        }

        public boolean isReserved() {
            return counter != null;
        }
    }
}
