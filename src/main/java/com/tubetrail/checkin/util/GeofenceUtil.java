package com.tubetrail.checkin.util;

import com.tubetrail.checkin.exception.InvalidCoordinatesException;

/**
 * Utility class for geofence calculations.
 *
 * Pure functions only: no clock, no I/O, no shared state. Identical inputs
 * always produce identical output, which audit replays rely on.
 */
public final class GeofenceUtil {

    // Earth's radius in meters
    private static final double EARTH_RADIUS_METERS = 6371000;

    private GeofenceUtil() {
    }

    /**
     * Calculate distance between two GPS coordinates using Haversine formula
     *
     * @param lat1 Latitude of first point
     * @param lon1 Longitude of first point
     * @param lat2 Latitude of second point
     * @param lon2 Longitude of second point
     * @return Distance in meters
     * @throws InvalidCoordinatesException if any coordinate is not finite or out of range
     */
    public static double calculateDistance(double lat1, double lon1, double lat2, double lon2) {
        requireValid(lat1, lon1);
        requireValid(lat2, lon2);

        double lat1Rad = Math.toRadians(lat1);
        double lat2Rad = Math.toRadians(lat2);
        double deltaLat = Math.toRadians(lat2 - lat1);
        double deltaLon = Math.toRadians(lon2 - lon1);

        // Haversine formula
        double a = Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2) +
                   Math.cos(lat1Rad) * Math.cos(lat2Rad) *
                   Math.sin(deltaLon / 2) * Math.sin(deltaLon / 2);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_METERS * c;
    }

    /**
     * Validates a coordinate pair that may be absent.
     *
     * @throws InvalidCoordinatesException if either value is null, not finite, or out of range
     */
    public static void requireValid(Double lat, Double lon) {
        if (lat == null || lon == null) {
            throw new InvalidCoordinatesException("Latitude and longitude are both required");
        }
        requireValid(lat.doubleValue(), lon.doubleValue());
    }

    private static void requireValid(double lat, double lon) {
        if (!Double.isFinite(lat) || lat < -90.0 || lat > 90.0) {
            throw new InvalidCoordinatesException("Latitude out of range: " + lat);
        }
        if (!Double.isFinite(lon) || lon < -180.0 || lon > 180.0) {
            throw new InvalidCoordinatesException("Longitude out of range: " + lon);
        }
    }
}
