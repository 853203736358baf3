package com.tubetrail.checkin.controller;

import com.tubetrail.checkin.dto.ApiResponse;
import com.tubetrail.checkin.dto.OcrResult;
import com.tubetrail.checkin.dto.RoundelVerificationRequest;
import com.tubetrail.checkin.service.OcrService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pre-flight roundel photo read.
 *
 *  POST /api/roundel/verify
 *
 * Always 200: an unreadable or unrecognised photo is a normal answer, and an
 * unavailable reader is reported with pending=true so the app can still save
 * the check-in as pending.
 */
@RestController
@RequestMapping("/api/roundel")
@RequiredArgsConstructor
@Slf4j
public class RoundelController {

    private final OcrService ocrService;

    @PostMapping("/verify")
    public ResponseEntity<ApiResponse> verify(@Valid @RequestBody RoundelVerificationRequest request) {
        OcrResult result = request.getStationId() != null && !request.getStationId().isBlank()
                ? ocrService.verifyForStation(request.getImageData(), request.getStationId())
                : ocrService.read(request.getImageData());

        log.info("ROUNDEL API: success: {}, error: {}, station: {}",
                result.isSuccess(), result.getErrorCode(), result.getMatchedStationId());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success",          result.isSuccess());
        body.put("station_id",       result.getMatchedStationId());
        body.put("station_name",     result.getMatchedStationName());
        body.put("station_text_raw", result.getStationTextRaw());
        body.put("confidence",       result.getConfidence());
        body.put("error",            result.getErrorCode());
        body.put("pending",          result.isUnavailable());
        body.put("suggestions",      result.getSuggestions());

        return ResponseEntity.ok(ApiResponse.success(body, messageFor(result)));
    }

    private static String messageFor(OcrResult result) {
        if (result.isSuccess()) {
            return "Station recognised: " + result.getMatchedStationName();
        }
        if (result.isUnavailable()) {
            return "Photo check is unavailable right now. You can still save this check-in as pending.";
        }
        switch (result.getErrorCode() != null ? result.getErrorCode() : "") {
            case "no_roundel":
                return "We couldn't see a Tube roundel in your photo. Try a clearer picture showing the full roundel.";
            case "name_not_readable":
                return "We found a roundel but couldn't read the station name. Please retake the photo closer and centered.";
            case "station_mismatch":
                return "This photo shows a different station.";
            default:
                return "We read '" + result.getStationTextRaw() + "' but couldn't match a station.";
        }
    }
}
