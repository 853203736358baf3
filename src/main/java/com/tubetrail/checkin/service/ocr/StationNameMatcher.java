package com.tubetrail.checkin.service.ocr;

import com.tubetrail.checkin.entity.Station;

import java.util.List;
import java.util.Optional;

/**
 * Maps free text read off a roundel onto the station catalogue.
 */
public interface StationNameMatcher {

    /**
     * Best catalogue station for the text, or empty when nothing is close enough.
     */
    Optional<Station> match(String extractedName, List<Station> catalogue);

    /**
     * Near misses to offer the user when match() found nothing, best first.
     */
    List<Station> suggest(String extractedName, List<Station> catalogue, int maxResults);
}
