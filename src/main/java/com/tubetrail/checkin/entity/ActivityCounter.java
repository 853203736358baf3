package com.tubetrail.checkin.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Per-activity sequence counter.
 *
 * Every check-in writer for an activity locks this row (SELECT ... FOR UPDATE)
 * before re-checking for duplicates and allocating the next seq_actual, so
 * concurrent check-ins to different stations of the same activity never
 * collide on a sequence number. The increment rolls back with the visit insert.
 */
@Entity
@Table(name = "activity_counters")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ActivityCounter {

    @Id
    @Column(name = "activity_id", length = 64)
    private String activityId;

    @Column(name = "last_sequence", nullable = false)
    private int lastSequence;

    /** Bumps the counter and returns the newly allocated sequence number. */
    public int next() {
        lastSequence = lastSequence + 1;
        return lastSequence;
    }
}
