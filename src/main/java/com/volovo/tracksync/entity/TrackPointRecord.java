package com.volovo.tracksync.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Stored GPS fix.
 *
 * {@code pointKey} is the dedup identity; writing the same point twice touches one row.
 * {@code runKey} and the source window record which sync run and window produced the row.
 */
@Entity
@Table(
    name = "track_points",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_track_points_point_key", columnNames = "point_key")
    },
    indexes = {
        @Index(name = "idx_track_points_device_time", columnList = "device_id, recorded_at")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrackPointRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "point_key", nullable = false, length = 128)
    private String pointKey;

    @Column(name = "device_id", nullable = false)
    private Long deviceId;

    /** Portal wall-clock time, no zone */
    @Column(name = "recorded_at", nullable = false)
    private LocalDateTime recordedAt;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    @Column(name = "sequence_index")
    private Integer sequenceIndex;

    private Double speed; // km/h as reported

    private Double direction;

    @Column(name = "odometer_delta")
    private Double odometerDelta;

    @Column(length = 64)
    private String status;

    @Column(length = 64)
    private String width;

    @Column(name = "run_key", length = 128)
    private String runKey;

    @Column(name = "source_window_from")
    private LocalDateTime sourceWindowFrom;

    @Column(name = "source_window_to")
    private LocalDateTime sourceWindowTo;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        if (this.createdAt == null) {
            this.createdAt = now;
        }
        this.updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
