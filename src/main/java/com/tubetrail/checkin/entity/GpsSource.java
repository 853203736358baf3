package com.tubetrail.checkin.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Provenance of the coordinates a geofence check was computed from.
 * EXIF (photo metadata) is preferred over DEVICE (phone GPS at upload time).
 */
public enum GpsSource {

    DEVICE,

    EXIF,

    NONE;

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }

    /** Lenient parse: unknown or missing values are treated as NONE. */
    @JsonCreator
    public static GpsSource fromCode(String value) {
        if (value == null) {
            return NONE;
        }
        for (GpsSource source : values()) {
            if (source.name().equalsIgnoreCase(value.trim())) {
                return source;
            }
        }
        return NONE;
    }
}
