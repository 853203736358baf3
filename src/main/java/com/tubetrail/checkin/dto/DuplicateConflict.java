package com.tubetrail.checkin.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Context returned with duplicate_visit / duplicate_visit_race so the app can
 * say which station and when, rather than a generic failure.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DuplicateConflict {

    String existingVisitId;

    /** Display name, or the raw station id when the name lookup failed */
    String stationName;

    LocalDateTime visitedAt;

}
