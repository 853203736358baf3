package com.tubetrail.checkin.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.*;

import java.time.OffsetDateTime;

/**
 * Check-in attempt as posted by the app.
 *
 * activity_id, station_id and user_id are required but not bean-validated;
 * VisitRecorder reports them as missing_fields.
 *
 * Absent flags default to the strict path: not a simulation, AI on, connected.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CheckinRequest {

    private String activityId;

    private String stationId;

    private String userId;

    private Boolean simulationMode;

    private Boolean aiEnabled;

    private Boolean hasConnectivity;

    private GeofenceClaim geofenceResult;

    private OcrClaim ocrResult;

    /** Distance to the station the client computed locally, in meters */
    private Double clientDistance;

    /** Photo (EXIF) coordinates */
    private Double latitude;

    private Double longitude;

    /** Device coordinates at upload time */
    private Double visitLat;

    private Double visitLon;

    private boolean exifTimePresent;

    private boolean exifGpsPresent;

    /** Base64 data URL of the roundel photo; sent to the photo reader when present */
    private String image;

    private String verificationImageUrl;

    /** EXIF DateTimeOriginal of the photo */
    private OffsetDateTime capturedAt;

    public boolean simulationRequested() {
        return Boolean.TRUE.equals(simulationMode);
    }

    public boolean aiRequested() {
        return !Boolean.FALSE.equals(aiEnabled);
    }

    public boolean connectivityReported() {
        return !Boolean.FALSE.equals(hasConnectivity);
    }

    public boolean hasExifCoordinates() {
        return latitude != null && longitude != null;
    }

    public boolean hasDeviceCoordinates() {
        return visitLat != null && visitLon != null;
    }
}
