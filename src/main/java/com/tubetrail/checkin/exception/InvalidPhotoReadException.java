package com.tubetrail.checkin.exception;

/**
 * Raised when a client-supplied photo read carries a confidence that is not
 * a finite value between 0.0 and 1.0. Mapped to HTTP 400 invalid_ocr_result.
 */
public class InvalidPhotoReadException extends RuntimeException {

    public InvalidPhotoReadException(String message) {
        super(message);
    }
}
