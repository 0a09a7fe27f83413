package com.example.fundraisingdashboard.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Accumulates what a table handler actually did, record by record.
 */
@Getter
public class WriteOutcome {
    private final List<Map<String, String>> beforeData = new ArrayList<>();
    private final List<Map<String, String>> afterData = new ArrayList<>();
    private final List<Map<String, String>> revertData = new ArrayList<>();
    private final List<String> failures = new ArrayList<>();
    private int affectedRecords;

    public void applied(Map<String, String> before, Map<String, String> after, Map<String, String> revert) {
        if (before != null) {
            beforeData.add(before);
        }
        if (after != null) {
            afterData.add(after);
        }
        if (revert != null) {
            revertData.add(revert);
        }
        affectedRecords++;
    }

    public void failed(String reason) {
        failures.add(reason);
    }

    public void merge(WriteOutcome other) {
        beforeData.addAll(other.beforeData);
        afterData.addAll(other.afterData);
        revertData.addAll(other.revertData);
        failures.addAll(other.failures);
        affectedRecords += other.affectedRecords;
    }
}
