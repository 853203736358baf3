package com.tubetrail.checkin.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe view of the "checkin.*" properties, validated at startup.
 *
 * The geofence radius has no code default; a deployment must state
 * it (application.properties, env CHECKIN_GEOFENCE_DEFAULTRADIUSMETERS, ...).
 * Per-station overrides live on Station.radiusMeters.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "checkin")
public class CheckinProperties {

    @Valid
    private Geofence geofence = new Geofence();

    @Valid
    private Ocr ocr = new Ocr();

    @Valid
    private Store store = new Store();

    private Seed seed = new Seed();

    @Getter
    @Setter
    public static class Geofence {

        @NotNull(message = "checkin.geofence.default-radius-meters must be configured")
        @Positive
        private Double defaultRadiusMeters;

        /** Max |server - client| distance, in meters, still counted as agreement */
        @PositiveOrZero
        private double clientToleranceMeters = 5.0;
    }

    @Getter
    @Setter
    public static class Ocr {

        /** Blank disables the vision call; every photo read then ends as ocr_failed */
        private String apiKey;

        @NotBlank
        private String apiBase = "https://api.openai.com/v1";

        @NotBlank
        private String model = "gpt-4o";

        /** Hard upper bound on one photo read, including queueing on the executor */
        @Positive
        private long timeoutMs = 8000;

        @Positive
        private long connectTimeoutMs = 3000;

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Getter
    @Setter
    public static class Store {

        /** Upper bound for the visit write transaction */
        @Positive
        private int transactionTimeoutSeconds = 10;
    }

    @Getter
    @Setter
    public static class Seed {

        /** Load the sample London station catalogue when the stations table is empty */
        private boolean enabled = true;
    }
}
