package com.example.fundraisingdashboard.service;

import com.example.fundraisingdashboard.exception.OperationFailedException;
import com.example.fundraisingdashboard.exception.SnapshotNotFoundException;
import com.example.fundraisingdashboard.exception.UnknownTargetException;
import com.example.fundraisingdashboard.model.BackupSnapshot;
import com.example.fundraisingdashboard.model.ChangeRecord;
import com.example.fundraisingdashboard.model.ExecutionResult;
import com.example.fundraisingdashboard.model.Operation;
import com.example.fundraisingdashboard.model.OperationKind;
import com.example.fundraisingdashboard.model.PipelineEvent;
import com.example.fundraisingdashboard.model.RiskTier;
import com.example.fundraisingdashboard.model.TableName;
import com.example.fundraisingdashboard.model.WriteOutcome;
import com.example.fundraisingdashboard.service.handler.TableHandler;
import com.example.fundraisingdashboard.store.TableRows;
import com.example.fundraisingdashboard.store.TabularStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Applies operations to the store through the per-table handlers and records each applied
 * change in the ledger.
 *
 * Executions are serialized: the read that captures prior row state and the writes that follow
 * must not interleave with another execution, since rows are addressed by position.
 */
@Slf4j
@Service
public class OperationExecutor {

    private final Map<TableName, TableHandler> handlers = new EnumMap<>(TableName.class);
    private final ReentrantLock lock = new ReentrantLock();
    private final TabularStore store;
    private final RiskClassifier classifier;
    private final SnapshotManager snapshots;
    private final ChangeLedger ledger;
    private final CacheInvalidationNotifier cacheNotifier;
    private final PipelineEventLog eventLog;
    private final Clock clock;

    public OperationExecutor(List<TableHandler> tableHandlers, TabularStore store, RiskClassifier classifier,
                             SnapshotManager snapshots, ChangeLedger ledger,
                             CacheInvalidationNotifier cacheNotifier, PipelineEventLog eventLog, Clock clock) {
        for (TableHandler handler : tableHandlers) {
            handlers.put(handler.table(), handler);
        }
        this.store = store;
        this.classifier = classifier;
        this.snapshots = snapshots;
        this.ledger = ledger;
        this.cacheNotifier = cacheNotifier;
        this.eventLog = eventLog;
        this.clock = clock;
    }

    /**
     * Reject operations no handler can carry out. Nothing is read or written.
     *
     * @throws UnknownTargetException for unsupported table/action combinations
     * @throws OperationFailedException when the payload addresses no records
     * @throws SnapshotNotFoundException when a restore names an unknown snapshot
     */
    public void checkSupported(Operation operation) {
        OperationKind kind = operation.getKind();
        TableName table = operation.getTable();
        if (kind == null || table == null) {
            throw new UnknownTargetException("Operation needs both a kind and a table");
        }

        switch (kind) {
            case REVERT:
            case BACKUP:
                throw new UnknownTargetException(kind.getValue() + " is not executed as a table write");
            case RESTORE:
                snapshots.require(operation.payloadString(Operation.SNAPSHOT_ID));
                return;
            case ERASE_ALL:
                if (table != TableName.ALL) {
                    handlerFor(table);
                }
                return;
            default:
                break;
        }

        handlerFor(table);
        if (operation.selectsAll()) {
            if (kind != OperationKind.DELETE && kind != OperationKind.BULK_DELETE) {
                throw new UnknownTargetException("'all' can only select rows to delete");
            }
            return;
        }
        if (operation.records().isEmpty()) {
            throw new OperationFailedException(kind.getValue() + " on " + table.getValue() + " addresses no records");
        }
    }

    /**
     * Execute the operation, taking a backup snapshot first when it is high or critical risk.
     *
     * @return the recorded change, with any per-record failures of a best-effort bulk operation
     * @throws OperationFailedException if no record could be applied; nothing is recorded
     * @throws com.example.fundraisingdashboard.exception.StoreAccessException if the store fails
     */
    public ExecutionResult execute(Operation operation) {
        checkSupported(operation);
        if (operation.getRiskTier() == null) {
            classifier.assess(operation);
        }

        lock.lock();
        try {
            // Fetch the restore source first: the safety snapshot below may evict it.
            BackupSnapshot source = null;
            if (operation.getKind() == OperationKind.RESTORE) {
                source = snapshots.require(operation.payloadString(Operation.SNAPSHOT_ID));
            }

            String backupId = null;
            if (operation.getRiskTier().atLeast(RiskTier.HIGH)) {
                backupId = snapshots.createSnapshot("Auto-backup before " + operation.getDescription()).getId();
            }

            WriteOutcome outcome = dispatch(operation, source);
            if (outcome.getAffectedRecords() == 0 && !outcome.getFailures().isEmpty()) {
                throw new OperationFailedException(String.join("; ", outcome.getFailures()));
            }

            ChangeRecord change = toChangeRecord(operation, outcome, backupId, source);
            ledger.append(change);
            cacheNotifier.tableChanged(operation.getTable());

            if (outcome.getFailures().isEmpty()) {
                log.info("Change {} recorded: {} on {} affected {} records",
                    change.getId(), operation.getKind().getValue(), operation.getTable().getValue(),
                    change.getAffectedRecords());
                eventLog.record(PipelineEvent.EventType.OPERATION_EXECUTED, change.getDescription(),
                    change.getId(), operation.getRequestedBy());
            } else {
                log.warn("Change {} partially applied: {} records, {} failures",
                    change.getId(), change.getAffectedRecords(), outcome.getFailures().size());
                eventLog.record(PipelineEvent.EventType.OPERATION_PARTIAL,
                    change.getAffectedRecords() + " applied, " + outcome.getFailures().size() + " failed",
                    change.getId(), operation.getRequestedBy());
            }
            return new ExecutionResult(change, new ArrayList<>(outcome.getFailures()), backupId);
        } finally {
            lock.unlock();
        }
    }

    // ==================== Dispatch ====================

    private WriteOutcome dispatch(Operation operation, BackupSnapshot source) {
        TableName table = operation.getTable();
        switch (operation.getKind()) {
            case CREATE:
            case BULK_CREATE:
                return handlerFor(table).create(operation.records());
            case UPDATE:
            case BULK_UPDATE:
                return handlerFor(table).update(operation.records());
            case DELETE:
            case BULK_DELETE:
                if (operation.selectsAll()) {
                    return handlerFor(table).deleteAll();
                }
                return handlerFor(table).delete(operation.records());
            case ERASE_ALL:
                return eraseAll(table);
            case RESTORE:
                return restore(source);
            default:
                throw new UnknownTargetException(operation.getKind().getValue() + " is not executed as a table write");
        }
    }

    private WriteOutcome eraseAll(TableName table) {
        if (table != TableName.ALL) {
            return handlerFor(table).deleteAll();
        }
        WriteOutcome outcome = new WriteOutcome();
        for (TableHandler handler : handlers.values()) {
            outcome.merge(handler.deleteAll());
        }
        return outcome;
    }

    /**
     * Overwrite every data table, row by row, with its content in the snapshot.
     * Rows already equal are left alone; surplus current rows are blanked.
     */
    private WriteOutcome restore(BackupSnapshot source) {
        WriteOutcome outcome = new WriteOutcome();
        for (TableName table : TableName.dataTables()) {
            int width = table.getColumns().size();
            List<List<String>> target = source.rows(table);
            List<List<String>> current = store.getRows(table);

            for (int i = 0; i < current.size(); i++) {
                List<String> existing = TableRows.toRow(table, TableRows.toRecord(table, current.get(i)));
                List<String> desired = i < target.size()
                    ? TableRows.toRow(table, TableRows.toRecord(table, target.get(i)))
                    : TableRows.blankRow(width);
                if (!desired.equals(existing)) {
                    store.updateRow(table, i, desired);
                    outcome.applied(recordOrNull(table, existing), recordOrNull(table, desired), null);
                }
            }

            if (target.size() > current.size()) {
                List<List<String>> missing = new ArrayList<>();
                for (List<String> row : target.subList(current.size(), target.size())) {
                    missing.add(TableRows.toRow(table, TableRows.toRecord(table, row)));
                }
                store.appendRows(table, missing);
                for (List<String> row : missing) {
                    outcome.applied(null, recordOrNull(table, row), null);
                }
            }
            log.debug("Restored {} from snapshot {}", table.getValue(), source.getId());
        }
        return outcome;
    }

    private ChangeRecord toChangeRecord(Operation operation, WriteOutcome outcome, String backupId,
                                        BackupSnapshot source) {
        OperationKind kind = operation.getKind();
        boolean isRevert = operation.getRevertOf() != null;
        boolean canRevert = !isRevert && kind != OperationKind.ERASE_ALL && kind != OperationKind.RESTORE;

        String description = operation.getDescription();
        if (isRevert) {
            description = "Revert of " + operation.getRevertOf() + ": " + description;
        }
        if (source != null) {
            description = description + " (restored from " + source.getId() + ")";
        }
        if (backupId != null) {
            description = description + " (backup " + backupId + ")";
        }

        return ChangeRecord.builder()
            .id(ChangeLedger.newChangeId())
            .timestamp(clock.instant())
            .operationKind(isRevert ? OperationKind.REVERT : kind)
            .table(operation.getTable())
            .description(description)
            .beforeData(outcome.getBeforeData())
            .afterData(outcome.getAfterData())
            .revertData(outcome.getRevertData())
            .affectedRecords(outcome.getAffectedRecords())
            .requestedBy(operation.getRequestedBy())
            .revertOf(operation.getRevertOf())
            .canRevert(canRevert)
            .build();
    }

    private TableHandler handlerFor(TableName table) {
        TableHandler handler = handlers.get(table);
        if (handler == null) {
            if (table == TableName.STATES) {
                throw new UnknownTargetException("The states table is read-only");
            }
            throw new UnknownTargetException("No handler for table '" + table.getValue() + "'");
        }
        return handler;
    }

    private static Map<String, String> recordOrNull(TableName table, List<String> row) {
        return TableRows.isBlank(row) ? null : TableRows.toRecord(table, row);
    }
}
