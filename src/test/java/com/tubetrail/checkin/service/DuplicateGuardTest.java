package com.tubetrail.checkin.service;

import com.tubetrail.checkin.dto.DuplicateConflict;
import com.tubetrail.checkin.entity.ActivityCounter;
import com.tubetrail.checkin.entity.Station;
import com.tubetrail.checkin.entity.StationVisit;
import com.tubetrail.checkin.exception.VisitStoreUnavailableException;
import com.tubetrail.checkin.repository.ActivityCounterRepository;
import com.tubetrail.checkin.repository.StationVisitRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DuplicateGuard.
 *
 * The real race behaviour is covered against H2 in CheckinConcurrencyIntegrationTest;
 * here we pin the decisions made under the lock and the conflict context.
 */
@ExtendWith(MockitoExtension.class)
class DuplicateGuardTest {

    // ── Mocks ────────────────────────────────────────────────────────────────

    @Mock private StationVisitRepository     stationVisitRepository;
    @Mock private ActivityCounterRepository  activityCounterRepository;
    @Mock private StationDirectory           stationDirectory;
    @Mock private PlatformTransactionManager transactionManager;

    @InjectMocks
    private DuplicateGuard duplicateGuard;

    // ── Test fixtures ─────────────────────────────────────────────────────────

    private static final String ACTIVITY = "A1";
    private static final String KSX      = "940GZZLUKSX";

    private static StationVisit existingVisit() {
        return StationVisit.builder()
                .id("visit-1")
                .activityId(ACTIVITY)
                .stationId(KSX)
                .sequenceNumber(1)
                .visitedAt(LocalDateTime.of(2026, 3, 1, 9, 30))
                .build();
    }

    // ════════════════════════════════════════════════════════════════════════
    // tryReserve
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("No existing visit: reservation holds the locked counter")
    void tryReserve_free_returnsCounter() {
        ActivityCounter counter = ActivityCounter.builder().activityId(ACTIVITY).lastSequence(2).build();
        when(activityCounterRepository.findByIdForUpdate(ACTIVITY)).thenReturn(Optional.of(counter));
        when(stationVisitRepository.findByActivityIdAndStationId(ACTIVITY, KSX)).thenReturn(Optional.empty());

        DuplicateGuard.ReservationResult result = duplicateGuard.tryReserve(ACTIVITY, KSX);

        assertThat(result.isReserved()).isTrue();
        assertThat(result.getCounter()).isSameAs(counter);
        assertThat(result.getExistingVisit()).isNull();
    }

    @Test
    @DisplayName("Existing visit seen under the lock: already exists, counter untouched")
    void tryReserve_taken_returnsExisting() {
        ActivityCounter counter = ActivityCounter.builder().activityId(ACTIVITY).lastSequence(1).build();
        when(activityCounterRepository.findByIdForUpdate(ACTIVITY)).thenReturn(Optional.of(counter));
        when(stationVisitRepository.findByActivityIdAndStationId(ACTIVITY, KSX)).thenReturn(Optional.of(existingVisit()));

        DuplicateGuard.ReservationResult result = duplicateGuard.tryReserve(ACTIVITY, KSX);

        assertThat(result.isReserved()).isFalse();
        assertThat(result.getExistingVisit().getId()).isEqualTo("visit-1");
        assertThat(counter.getLastSequence()).isEqualTo(1);
    }

    @Test
    @DisplayName("Lock is taken before the duplicate re-check")
    void tryReserve_locksFirst() {
        when(activityCounterRepository.findByIdForUpdate(ACTIVITY))
                .thenReturn(Optional.of(ActivityCounter.builder().activityId(ACTIVITY).lastSequence(0).build()));
        when(stationVisitRepository.findByActivityIdAndStationId(ACTIVITY, KSX)).thenReturn(Optional.empty());

        duplicateGuard.tryReserve(ACTIVITY, KSX);

        var order = inOrder(activityCounterRepository, stationVisitRepository);
        order.verify(activityCounterRepository).findByIdForUpdate(ACTIVITY);
        order.verify(stationVisitRepository).findByActivityIdAndStationId(ACTIVITY, KSX);
    }

    @Test
    @DisplayName("Missing counter row is a store failure")
    void tryReserve_missingCounter_throws() {
        when(activityCounterRepository.findByIdForUpdate(ACTIVITY)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> duplicateGuard.tryReserve(ACTIVITY, KSX))
                .isInstanceOf(VisitStoreUnavailableException.class);
        verify(stationVisitRepository, never()).findByActivityIdAndStationId(any(), any());
    }

    // ════════════════════════════════════════════════════════════════════════
    // ensureCounter
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Existing counter is left alone")
    void ensureCounter_exists_noInsert() {
        when(activityCounterRepository.existsById(ACTIVITY)).thenReturn(true);

        duplicateGuard.ensureCounter(ACTIVITY);

        verify(activityCounterRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("Missing counter is created at zero")
    void ensureCounter_missing_createsAtZero() {
        when(activityCounterRepository.existsById(ACTIVITY)).thenReturn(false);

        duplicateGuard.ensureCounter(ACTIVITY);

        verify(activityCounterRepository).saveAndFlush(argThat(c ->
                c.getActivityId().equals(ACTIVITY) && c.getLastSequence() == 0));
    }

    @Test
    @DisplayName("Losing the counter-creation race is not an error")
    void ensureCounter_concurrentCreate_tolerated() {
        when(activityCounterRepository.existsById(ACTIVITY)).thenReturn(false);
        when(activityCounterRepository.saveAndFlush(any())).thenThrow(new DataIntegrityViolationException("pk"));

        assertThatCode(() -> duplicateGuard.ensureCounter(ACTIVITY)).doesNotThrowAnyException();
    }

    // ════════════════════════════════════════════════════════════════════════
    // describeConflict
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Conflict carries visit id, station name and visit time")
    void describeConflict_resolvesName() {
        when(stationDirectory.findStation(KSX)).thenReturn(Optional.of(
                Station.builder().id(KSX).name("King's Cross St. Pancras").latitude(51.5308).longitude(-0.1238).build()));

        DuplicateConflict conflict = duplicateGuard.describeConflict(existingVisit());

        assertThat(conflict.getExistingVisitId()).isEqualTo("visit-1");
        assertThat(conflict.getStationName()).isEqualTo("King's Cross St. Pancras");
        assertThat(conflict.getVisitedAt()).isEqualTo(LocalDateTime.of(2026, 3, 1, 9, 30));
    }

    @Test
    @DisplayName("Name lookup failure falls back to the raw station id")
    void describeConflict_lookupFails_usesId() {
        when(stationDirectory.findStation(KSX)).thenThrow(new DataAccessResourceFailureException("down"));

        assertThat(duplicateGuard.describeConflict(existingVisit()).getStationName()).isEqualTo(KSX);
    }

    @Test
    @DisplayName("Unknown station falls back to the raw station id")
    void describeConflict_unknownStation_usesId() {
        when(stationDirectory.findStation(KSX)).thenReturn(Optional.empty());

        assertThat(duplicateGuard.describeConflict(existingVisit()).getStationName()).isEqualTo(KSX);
    }
}
