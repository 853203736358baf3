package com.tubetrail.checkin.dto;

import com.tubetrail.checkin.entity.StationVisit;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of one VisitRecorder.recordVisit call.
 *
 * Business outcomes only. Infrastructure failures are thrown, not returned.
 * A visit is attached only to RECORDED outcomes: every other kind means
 * nothing was written and no sequence number was consumed.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CheckinOutcome {

    public enum Kind {
        RECORDED,
        DUPLICATE,
        MISSING_FIELDS,
        STATION_NOT_FOUND,
        FORBIDDEN
    }

    public static final String CODE_DUPLICATE      = "duplicate_visit";
    public static final String CODE_DUPLICATE_RACE = "duplicate_visit_race";
    public static final String CODE_MISSING_FIELDS = "missing_fields";
    public static final String CODE_STATION_NOT_FOUND = "station_not_found";
    public static final String CODE_FORBIDDEN      = "forbidden";

    private final Kind kind;
    private final String errorCode;
    private final String message;
    private final StationVisit visit;
    private final DuplicateConflict duplicate;

    public static CheckinOutcome recorded(StationVisit visit) {
        return new CheckinOutcome(Kind.RECORDED, null, null, visit, null);
    }

    /**
     * @param detectedMidRace true when the conflict surfaced only under the
     *                        activity lock or at the unique constraint
     */
    public static CheckinOutcome duplicate(DuplicateConflict conflict, boolean detectedMidRace) {
        return new CheckinOutcome(Kind.DUPLICATE,
                detectedMidRace ? CODE_DUPLICATE_RACE : CODE_DUPLICATE,
                duplicateMessage(conflict.getStationName()),
                null, conflict);
    }

    public static CheckinOutcome missingFields(String message) {
        return new CheckinOutcome(Kind.MISSING_FIELDS, CODE_MISSING_FIELDS, message, null, null);
    }

    public static CheckinOutcome stationNotFound(String message) {
        return new CheckinOutcome(Kind.STATION_NOT_FOUND, CODE_STATION_NOT_FOUND, message, null, null);
    }

    public static CheckinOutcome forbidden(String message) {
        return new CheckinOutcome(Kind.FORBIDDEN, CODE_FORBIDDEN, message, null, null);
    }

    public boolean isRecorded() {
        return kind == Kind.RECORDED;
    }

    /** Fixed product copy: "to", not "at". */
    public static String duplicateMessage(String stationName) {
        return "Already checked in to " + stationName + " for this activity.";
    }
}
