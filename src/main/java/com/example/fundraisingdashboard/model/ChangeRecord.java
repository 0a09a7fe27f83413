package com.example.fundraisingdashboard.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable ledger entry for an executed mutation. Only the revert flag ever changes,
 * and only from true to false.
 */
@Getter
@ToString(exclude = {"beforeData", "afterData", "revertData"})
public class ChangeRecord {

    private final String id;
    private final Instant timestamp;
    private final OperationKind operationKind;
    private final TableName table;
    private final String description;

    /**
     * Rows as they were before the write, captured ahead of it. Empty for creates.
     */
    private final List<Map<String, String>> beforeData;

    /**
     * Rows as written.
     */
    private final List<Map<String, String>> afterData;

    private final int affectedRecords;

    /**
     * Records the inverse operation needs: keys of created rows, prior state of updated or deleted rows.
     */
    private final List<Map<String, String>> revertData;

    private final String requestedBy;

    /**
     * Id of the change this entry reverted, for revert entries.
     */
    private final String revertOf;

    private volatile boolean canRevert;

    @Builder
    public ChangeRecord(String id, Instant timestamp, OperationKind operationKind, TableName table,
                        String description, List<Map<String, String>> beforeData,
                        List<Map<String, String>> afterData, int affectedRecords,
                        List<Map<String, String>> revertData, String requestedBy, String revertOf,
                        boolean canRevert) {
        this.id = id;
        this.timestamp = timestamp;
        this.operationKind = operationKind;
        this.table = table;
        this.description = description;
        this.beforeData = beforeData != null ? List.copyOf(beforeData) : List.of();
        this.afterData = afterData != null ? List.copyOf(afterData) : List.of();
        this.affectedRecords = affectedRecords;
        this.revertData = revertData != null ? List.copyOf(revertData) : List.of();
        this.requestedBy = requestedBy;
        this.revertOf = revertOf;
        this.canRevert = canRevert;
    }

    public void markReverted() {
        this.canRevert = false;
    }
}
