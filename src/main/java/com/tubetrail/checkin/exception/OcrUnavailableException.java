package com.tubetrail.checkin.exception;

/**
 * The photo reader could not produce an answer: network error, timeout,
 * upstream 5xx, or a response that could not be parsed.
 *
 * Never reaches a controller from the check-in path - OcrService converts it
 * into an ocr_failed result.
 */
public class OcrUnavailableException extends RuntimeException {

    private final String errorCode;

    public OcrUnavailableException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public OcrUnavailableException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /** network_error, timeout, api_error, malformed_response or verification_disabled */
    public String getErrorCode() {
        return errorCode;
    }
}
