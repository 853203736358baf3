package com.tubetrail.checkin.exception;

/**
 * The visit store could not complete a write. Retryable: no visit was stored
 * and no sequence number was consumed.
 */
public class VisitStoreUnavailableException extends RuntimeException {

    public VisitStoreUnavailableException(String message) {
        super(message);
    }

    public VisitStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
