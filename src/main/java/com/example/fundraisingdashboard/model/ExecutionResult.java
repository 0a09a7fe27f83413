package com.example.fundraisingdashboard.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Outcome of a successful (possibly partial) execution.
 */
@Getter
@AllArgsConstructor
public class ExecutionResult {

    /**
     * The recorded change. Null only for a revert that found nothing left to write.
     */
    private final ChangeRecord change;

    /**
     * Per-record failures of a best-effort bulk operation. Empty when everything applied.
     */
    private final List<String> failures;

    /**
     * Safety snapshot taken before a high or critical write, null otherwise.
     */
    private final String backupSnapshotId;

    public boolean isPartial() {
        return !failures.isEmpty();
    }
}
