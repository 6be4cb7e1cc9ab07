package com.volovo.tracksync.repository;

import com.volovo.tracksync.entity.SyncCursor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SyncCursorRepository extends JpaRepository<SyncCursor, Long> {
}
