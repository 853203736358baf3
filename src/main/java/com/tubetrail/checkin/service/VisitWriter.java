package com.tubetrail.checkin.service;

import com.tubetrail.checkin.config.CheckinProperties;
import com.tubetrail.checkin.dto.GeofenceValidationResult;
import com.tubetrail.checkin.dto.OcrResult;
import com.tubetrail.checkin.entity.StationVisit;
import com.tubetrail.checkin.exception.VisitStoreUnavailableException;
import com.tubetrail.checkin.repository.StationVisitRepository;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

/**
 * The only code path that inserts a StationVisit.
 *
 * One READ_COMMITTED transaction with a bounded timeout:
 *   lock activity counter → re-check duplicate → allocate seq → insert → audit → commit.
 * Either all of it commits or none of it does; a rolled-back attempt leaves
 * the counter untouched, so duplicates never consume a sequence number.
 */
@Service
@Slf4j
public class VisitWriter {

    private final DuplicateGuard duplicateGuard;
    private final StationVisitRepository stationVisitRepository;
    private final AuditService auditService;
    private final TransactionTemplate writeTransaction;

    public VisitWriter(DuplicateGuard duplicateGuard,
                       StationVisitRepository stationVisitRepository,
                       AuditService auditService,
                       PlatformTransactionManager transactionManager,
                       CheckinProperties properties) {
        this.duplicateGuard = duplicateGuard;
        this.stationVisitRepository = stationVisitRepository;
        this.auditService = auditService;
        this.writeTransaction = new TransactionTemplate(transactionManager);
        this.writeTransaction.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.writeTransaction.setTimeout(properties.getStore().getTransactionTimeoutSeconds());
    }

    /**
     * Persists the draft visit (seq not yet set).
     *
     * @throws VisitStoreUnavailableException when the store cannot complete the
     *         write (lock wait expired, transaction timeout, connection failure)
     */
    public WriteResult write(StationVisit draft, GeofenceValidationResult geofence, OcrResult ocr) {
        String activityId = draft.getActivityId();
        String stationId = draft.getStationId();

        try {
            duplicateGuard.ensureCounter(activityId);

            return writeTransaction.execute(status -> {
                DuplicateGuard.ReservationResult reservation = duplicateGuard.tryReserve(activityId, stationId);
                if (!reservation.isReserved()) {
                    return WriteResult.duplicate(reservation.getExistingVisit());
                }

                draft.setSequenceNumber(reservation.getCounter().next());
                StationVisit saved = stationVisitRepository.saveAndFlush(draft);
                auditService.recordVisit(saved, geofence, ocr);

                log.info("Visit stored - id: {}, activity: {}, station: {}, seq: {}, status: {}",
                        saved.getId(), activityId, stationId, saved.getSequenceNumber(), saved.getStatus());
                return WriteResult.recorded(saved);
            });

        } catch (DataIntegrityViolationException e) {
            // Unique constraint fired at flush: another writer got the slot first.
            Optional<StationVisit> winner = stationVisitRepository.findByActivityIdAndStationId(activityId, stationId);
            if (winner.isPresent()) {
                log.info("Duplicate detected at unique constraint - activity: {}, station: {}, existing visit: {}",
                        activityId, stationId, winner.get().getId());
                return WriteResult.duplicate(winner.get());
            }
            throw e;
        } catch (TransactionException | DataAccessException e) {
            log.error("Visit store unavailable - activity: {}, station: {} - {}", activityId, stationId, e.getMessage());
            throw new VisitStoreUnavailableException("Visit could not be stored", e);
        }
    }

    /**
     * Outcome of {@link #write}. A duplicate found here was not visible to the
     * pre-check, so it is always reported as detected mid-race.
     */
    @Getter
    @AllArgsConstructor(access = AccessLevel.PRIVATE)
    public static class WriteResult {

        private final StationVisit visit;
        private final StationVisit existingVisit;

        static WriteResult recorded(StationVisit visit) {
            return new WriteResult(visit, null);
        }

        static WriteResult duplicate(StationVisit existingVisit) {
            return new WriteResult(null, existingVisit);
        }

        public boolean isRecorded() {
            return visit != null;
        }
    }
}
