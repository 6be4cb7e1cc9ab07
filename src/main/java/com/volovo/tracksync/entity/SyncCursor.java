package com.volovo.tracksync.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Per-device high-water mark: everything before {@code lastSyncedAt} is stored.
 */
@Entity
@Table(name = "sync_cursors")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SyncCursor {

    @Id
    @Column(name = "device_id")
    private Long deviceId;

    @Column(name = "last_synced_at", nullable = false)
    private LocalDateTime lastSyncedAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        this.updatedAt = LocalDateTime.now();
    }
}
