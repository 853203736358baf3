package com.tubetrail.checkin.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.*;

/**
 * Photo read result supplied with the check-in when the photo was verified
 * ahead of time through /api/roundel/verify.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OcrClaim {

    private boolean success;

    private double confidence;

    private String stationTextRaw;

}
