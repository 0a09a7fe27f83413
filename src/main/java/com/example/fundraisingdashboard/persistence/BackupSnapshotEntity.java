package com.example.fundraisingdashboard.persistence;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persistent storage for backup snapshots.
 */
@Entity
@Table(name = "backup_snapshot")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BackupSnapshotEntity {

    @Id
    private String id;

    /**
     * Epoch millis.
     */
    @Column(name = "created_at", nullable = false)
    private long timestamp;

    @Column(length = 1000)
    private String description;

    /**
     * Table name to positional rows, as JSON.
     */
    @Lob
    @Column(nullable = false)
    private String tablesData;

    /**
     * Size in bytes for monitoring.
     */
    @Column(nullable = false)
    private long sizeBytes;
}
