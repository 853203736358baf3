package com.tubetrail.checkin.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One accepted check-in at a station within an activity.
 *
 * Core invariant: (activity_id, station_id) is unique. The unique constraint
 * below is the store-level backstop behind DuplicateGuard; a violation at flush
 * time is reported to the caller as duplicate_visit_race.
 *
 * Location fields (latitude/longitude, visitLat/visitLon, geofenceDistanceM,
 * clientDistanceM) are null and gpsSource is NONE when isSimulation is true.
 * The EXIF presence flags describe the photo and are kept regardless.
 */
@Entity
@Table(
    name = "station_visits",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_station_visits_activity_station",
                columnNames = {"activity_id", "station_id"})
    },
    indexes = {
        @Index(name = "idx_station_visits_activity_seq", columnList = "activity_id, seq_actual"),
        @Index(name = "idx_station_visits_user_id",      columnList = "user_id")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StationVisit {

    @Id
    @Column(length = 36, updatable = false)
    private String id;

    @Column(name = "activity_id", nullable = false, updatable = false)
    private String activityId;

    @Column(name = "station_id", nullable = false, updatable = false)
    private String stationId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private VisitStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "pending_reason", length = 32)
    private PendingReason pendingReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "verification_method", nullable = false, length = 16)
    private VerificationMethod verificationMethod;

    /** 1-based arrival order within the activity, allocated under the activity counter lock */
    @Column(name = "seq_actual", nullable = false, updatable = false)
    private Integer sequenceNumber;

    /** Photo (EXIF) position */
    private Double latitude;

    private Double longitude;

    /** Device position at upload time */
    @Column(name = "visit_lat")
    private Double visitLat;

    @Column(name = "visit_lon")
    private Double visitLon;

    @Enumerated(EnumType.STRING)
    @Column(name = "gps_source", nullable = false, length = 16)
    private GpsSource gpsSource;

    /** Server-computed haversine distance, rounded to whole metres */
    @Column(name = "geofence_distance_m")
    private Double geofenceDistanceM;

    /** Distance the client claimed; audit only */
    @Column(name = "client_distance_m")
    private Double clientDistanceM;

    @Column(name = "client_server_match")
    private Boolean clientServerMatch;

    @Column(name = "exif_time_present", nullable = false)
    private boolean exifTimePresent;

    @Column(name = "exif_gps_present", nullable = false)
    private boolean exifGpsPresent;

    @Column(name = "ai_station_text")
    private String aiStationText;

    @Column(name = "ai_confidence")
    private Double aiConfidence;

    @Column(name = "verification_image_url", length = 1024)
    private String verificationImageUrl;

    @Column(name = "captured_at")
    private LocalDateTime capturedAt;

    @Column(name = "is_simulation", nullable = false, updatable = false)
    private boolean simulation;

    /** Server time of the check-in - never taken from the request */
    @Column(name = "visited_at", nullable = false)
    private LocalDateTime visitedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.id == null) {
            this.id = UUID.randomUUID().toString();
        }
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }
}
