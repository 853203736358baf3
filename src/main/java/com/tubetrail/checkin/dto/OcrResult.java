package com.tubetrail.checkin.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Structured read of a roundel photo.
 *
 * success=false covers both "read but rejected" (no_roundel, name_not_readable,
 * name_not_recognized, station_mismatch) and "reader unavailable" (unavailable=true:
 * timeout, network_error, api_error, malformed_response, verification_disabled).
 * Both land on ocr_failed in the status decision.
 */
@Value
@Builder(toBuilder = true)
public class OcrResult {

    boolean success;

    /** 0.0 to 1.0 */
    double confidence;

    String stationTextRaw;

    String matchedStationId;

    String matchedStationName;

    String errorCode;

    boolean unavailable;

    @Singular
    List<String> suggestions;

    public static OcrResult unavailable(String errorCode) {
        return OcrResult.builder()
                .success(false)
                .confidence(0.0)
                .errorCode(errorCode)
                .unavailable(true)
                .build();
    }

    public static OcrResult rejected(String errorCode, String stationTextRaw, double confidence) {
        return OcrResult.builder()
                .success(false)
                .confidence(confidence)
                .stationTextRaw(stationTextRaw)
                .errorCode(errorCode)
                .build();
    }
}
