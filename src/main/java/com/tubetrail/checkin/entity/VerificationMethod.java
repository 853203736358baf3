package com.tubetrail.checkin.entity;

/**
 * How a visit's status was reached, independent of whether it passed.
 */
public enum VerificationMethod {

    SIMULATION,

    MANUAL,

    AI_IMAGE,

    GPS,

    OFFLINE;

    public String code() {
        return name().toLowerCase();
    }
}
