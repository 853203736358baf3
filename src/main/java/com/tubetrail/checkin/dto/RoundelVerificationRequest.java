package com.tubetrail.checkin.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

/**
 * DTO for a pre-flight roundel photo read.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RoundelVerificationRequest {

    /** Base64 data URL ("data:image/jpeg;base64,...") or a fetchable image URL */
    @NotBlank(message = "imageData is required")
    private String imageData;

    /** Station the user is trying to check in to; optional */
    private String stationId;

}
