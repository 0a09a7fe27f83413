package com.example.fundraisingdashboard.persistence;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Durable copy of a change ledger entry. Row data is kept as JSON.
 */
@Entity
@Table(name = "change_record")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChangeRecordEntity {

    @Id
    private String id;

    /**
     * Epoch millis.
     */
    @Column(name = "created_at", nullable = false)
    private long timestamp;

    @Column(nullable = false)
    private String operationKind;

    @Column(name = "table_name", nullable = false)
    private String tableName;

    @Column(length = 1000)
    private String description;

    @Lob
    @Column(nullable = false)
    private String beforeData;

    @Lob
    @Column(nullable = false)
    private String afterData;

    @Lob
    @Column(nullable = false)
    private String revertData;

    @Column(nullable = false)
    private int affectedRecords;

    private String requestedBy;

    private String revertOf;

    @Column(nullable = false)
    private boolean canRevert;
}
