package com.tubetrail.checkin.service.ocr;

import com.tubetrail.checkin.dto.OcrResult;

/**
 * Reads a roundel photo and names the station on it.
 *
 * Implementations return a rejected OcrResult when the photo was read but did
 * not yield a catalogue station, and throw OcrUnavailableException when no
 * answer could be obtained at all.
 */
public interface OcrAdapter {

    /**
     * @param imageData data URL or https URL of the photo
     */
    OcrResult verifyImage(String imageData);
}
