package com.tubetrail.checkin.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Entity representing a station in the catalogue.
 * The id is the operator's stop identifier (e.g. TfL "940GZZLUKSX").
 */
@Entity
@Table(name = "stations")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Station {

    @Id
    @Column(name = "station_id", length = 64)
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    // Optional per-station geofence radius; null means use checkin.geofence.default-radius-meters
    @Column(name = "radius_meters")
    private Double radiusMeters;

}
