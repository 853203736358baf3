package com.tubetrail.checkin.service.ocr;

import com.tubetrail.checkin.dto.OcrResult;
import com.tubetrail.checkin.exception.OcrUnavailableException;

/**
 * Used when no vision API key is configured.
 */
public class UnavailableOcrAdapter implements OcrAdapter {

    public static final String ERROR_CODE = "verification_disabled";

    @Override
    public OcrResult verifyImage(String imageData) {
        throw new OcrUnavailableException(ERROR_CODE, "Photo verification is not configured");
    }
}
