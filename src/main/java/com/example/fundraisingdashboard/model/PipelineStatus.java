package com.example.fundraisingdashboard.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class PipelineStatus {
    private List<ChangeRecord> recentChanges;
    private List<ChangeRecord> revertableChanges;
    private List<ChangeRecord> criticalOperations;
    private List<BackupSnapshot> snapshots;
    private List<String> pendingOperationIds;
}
