package com.tubetrail.checkin.exception;

/**
 * Raised when a latitude/longitude pair is missing, not finite, or outside
 * the WGS84 range (lat ±90, lng ±180). Mapped to HTTP 400 invalid_coordinates.
 */
public class InvalidCoordinatesException extends RuntimeException {

    public InvalidCoordinatesException(String message) {
        super(message);
    }
}
