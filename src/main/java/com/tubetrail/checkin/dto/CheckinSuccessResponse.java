package com.tubetrail.checkin.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tubetrail.checkin.entity.StationVisit;
import lombok.Builder;
import lombok.Value;

/**
 * Body of a successful check-in. A pending visit is still a success.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CheckinSuccessResponse {

    boolean success;

    String visitId;

    Integer seqActual;

    String status;

    String pendingReason;

    String verificationMethod;

    public static CheckinSuccessResponse from(StationVisit visit) {
        return CheckinSuccessResponse.builder()
                .success(true)
                .visitId(visit.getId())
                .seqActual(visit.getSequenceNumber())
                .status(visit.getStatus().code())
                .pendingReason(visit.getPendingReason() != null ? visit.getPendingReason().code() : null)
                .verificationMethod(visit.getVerificationMethod().code())
                .build();
    }
}
