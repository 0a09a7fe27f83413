package com.example.fundraisingdashboard.service;

import com.example.fundraisingdashboard.exception.RevertIneligibleException;
import com.example.fundraisingdashboard.model.ChangeRecord;
import com.example.fundraisingdashboard.model.ExecutionResult;
import com.example.fundraisingdashboard.model.Operation;
import com.example.fundraisingdashboard.model.OperationKind;
import com.example.fundraisingdashboard.model.PipelineEvent;
import com.example.fundraisingdashboard.model.RiskTier;
import com.example.fundraisingdashboard.model.TableName;
import com.example.fundraisingdashboard.store.TableRows;
import com.example.fundraisingdashboard.store.TabularStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Undoes a recorded change by executing its inverse. A change is reverted at most once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RevertEngine {

    private final ChangeLedger ledger;
    private final SnapshotManager snapshots;
    private final OperationExecutor executor;
    private final PipelineEventLog eventLog;
    private final TabularStore store;

    /**
     * Revert a change. On any failure, including a partially applied inverse, the original
     * stays revertable so the revert can be retried. A retry only touches the records that are
     * not yet back in their prior state.
     *
     * @return the execution of the inverse operation; its change is null when every record was
     *         already back in its prior state and nothing had to be written
     * @throws RevertIneligibleException if the change is unknown, already reverted or has no inverse
     */
    public ExecutionResult revert(String changeId, String actor) {
        ChangeRecord original = ledger.beginRevert(changeId);
        boolean completed = false;
        try {
            Operation inverse = inverseOf(original);
            inverse.setRequestedBy(actor);

            List<Map<String, Object>> outstanding = outstanding(inverse);
            if (outstanding.isEmpty()) {
                log.info("Every record of change {} is already in its prior state", changeId);
                markReverted(original, actor);
                completed = true;
                return new ExecutionResult(null, List.of(), null);
            }
            int total = inverse.records().size();
            if (outstanding.size() < total) {
                log.info("Reverting {} of {} records of change {}, the rest are already reverted",
                    outstanding.size(), total, changeId);
                inverse.getPayload().put(Operation.RECORDS, outstanding);
            }

            snapshots.createSnapshot("Auto-backup before reverting " + changeId);
            ExecutionResult result = executor.execute(inverse);

            if (!result.isPartial()) {
                log.info("Change {} reverted by {}", changeId, result.getChange().getId());
                markReverted(original, actor);
                completed = true;
            } else {
                log.warn("Revert of {} only partially applied, leaving it revertable", changeId);
            }
            return result;
        } finally {
            if (!completed) {
                ledger.abortRevert(changeId);
            }
        }
    }

    private void markReverted(ChangeRecord original, String actor) {
        ledger.completeRevert(original.getId());
        eventLog.record(PipelineEvent.EventType.CHANGE_REVERTED,
            "Reverted " + original.getOperationKind().getValue() + " on " + original.getTable().getValue(),
            original.getId(), actor);
    }

    /**
     * Records of the inverse that still have to be applied. A record is done when its row is
     * gone (undoing a create) or the live row already holds the prior values (undoing an update
     * or a delete).
     */
    List<Map<String, Object>> outstanding(Operation inverse) {
        TableName table = inverse.getTable();
        Map<String, Map<String, String>> live = new HashMap<>();
        for (Map<String, String> record : TableRows.liveRecords(table, store.getRows(table))) {
            String key = TableRows.keyOf(table, record);
            if (key != null) {
                live.putIfAbsent(key, record);
            }
        }

        boolean removesRows = inverse.getKind() == OperationKind.DELETE
            || inverse.getKind() == OperationKind.BULK_DELETE;
        List<Map<String, Object>> remaining = new ArrayList<>();
        for (Map<String, Object> record : inverse.records()) {
            Map<String, String> cells = TableRows.toCells(table, record);
            String key = TableRows.keyOf(table, cells);
            Map<String, String> current = key != null ? live.get(key) : null;
            boolean done = removesRows ? current == null : current != null && holds(current, cells);
            if (!done) {
                remaining.add(record);
            }
        }
        return remaining;
    }

    private static boolean holds(Map<String, String> current, Map<String, String> expected) {
        for (Map.Entry<String, String> cell : expected.entrySet()) {
            if (!cell.getValue().equals(current.getOrDefault(cell.getKey(), ""))) {
                return false;
            }
        }
        return true;
    }

    /**
     * The operation that undoes a change: created rows are deleted, updated rows get their
     * previous values back and deleted rows are recreated.
     */
    Operation inverseOf(ChangeRecord change) {
        List<Map<String, String>> data = change.getRevertData();
        OperationKind kind;
        switch (change.getOperationKind()) {
            case CREATE:
                kind = OperationKind.DELETE;
                break;
            case BULK_CREATE:
                kind = OperationKind.BULK_DELETE;
                break;
            case UPDATE:
                kind = OperationKind.UPDATE;
                break;
            case BULK_UPDATE:
                kind = OperationKind.BULK_UPDATE;
                break;
            case DELETE:
                kind = OperationKind.CREATE;
                break;
            case BULK_DELETE:
                kind = OperationKind.BULK_CREATE;
                break;
            default:
                throw new RevertIneligibleException(change.getOperationKind().getValue() + " changes cannot be reverted");
        }
        if (data.isEmpty()) {
            throw new RevertIneligibleException("Change " + change.getId() + " holds no data to revert");
        }

        List<Map<String, Object>> records = new ArrayList<>();
        for (Map<String, String> row : data) {
            records.add(new LinkedHashMap<String, Object>(row));
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(Operation.RECORDS, records);

        Operation inverse = new Operation(kind, change.getTable(), payload,
            "Undo " + change.getOperationKind().getValue() + " on " + change.getTable().getValue());
        inverse.setRevertOf(change.getId());
        inverse.setRiskTier(RiskTier.MEDIUM);
        inverse.setRequiresConfirmation(false);
        return inverse;
    }
}
