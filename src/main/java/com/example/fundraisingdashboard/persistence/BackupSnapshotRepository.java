package com.example.fundraisingdashboard.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for persisting backup snapshots.
 */
@Repository
public interface BackupSnapshotRepository extends JpaRepository<BackupSnapshotEntity, String> {

    List<BackupSnapshotEntity> findAllByOrderByTimestampDesc(Pageable pageable);
}
