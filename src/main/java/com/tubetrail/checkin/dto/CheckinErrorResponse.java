package com.tubetrail.checkin.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Error envelope shared by check-in rejections and infrastructure failures:
 * <pre>
 * { "success": false, "data": null,
 *   "error": { "code": "...", "message": "...", "duplicate": {...}, "retryable": true } }
 * </pre>
 * Never carries a visit_id or seq_actual.
 */
@Value
@JsonInclude(JsonInclude.Include.ALWAYS)
public class CheckinErrorResponse {

    boolean success = false;

    Object data = null;

    ErrorBody error;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorBody {

        String code;

        String message;

        DuplicateConflict duplicate;

        Boolean retryable;
    }

    public static CheckinErrorResponse of(String code, String message) {
        return new CheckinErrorResponse(ErrorBody.builder().code(code).message(message).build());
    }

    public static CheckinErrorResponse retryable(String code, String message) {
        return new CheckinErrorResponse(ErrorBody.builder()
                .code(code).message(message).retryable(true).build());
    }

    public static CheckinErrorResponse from(CheckinOutcome outcome) {
        return new CheckinErrorResponse(ErrorBody.builder()
                .code(outcome.getErrorCode())
                .message(outcome.getMessage())
                .duplicate(outcome.getDuplicate())
                .build());
    }
}
