package com.volovo.tracksync.repository;

import com.volovo.tracksync.entity.TrackPointRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface TrackPointRepository extends JpaRepository<TrackPointRecord, Long> {

    /** Existing rows for a batch of dedup keys, one round-trip per flush */
    List<TrackPointRecord> findByPointKeyIn(Collection<String> pointKeys);

    /**
     * Device track in time order; {@code from} and {@code to} are both optional bounds.
     */
    @Query("SELECT p FROM TrackPointRecord p WHERE p.deviceId = :deviceId "
            + "AND (:fromTime IS NULL OR p.recordedAt >= :fromTime) "
            + "AND (:toTime IS NULL OR p.recordedAt <= :toTime) "
            + "ORDER BY p.recordedAt ASC, p.id ASC")
    List<TrackPointRecord> findTrack(@Param("deviceId") Long deviceId,
                                     @Param("fromTime") LocalDateTime from,
                                     @Param("toTime") LocalDateTime to,
                                     Pageable pageable);

    /** Devices with at least one stored point, as [deviceId, count] rows ordered by device */
    @Query("SELECT p.deviceId, COUNT(p) FROM TrackPointRecord p GROUP BY p.deviceId ORDER BY p.deviceId ASC")
    List<Object[]> countByDevice(Pageable pageable);
}
