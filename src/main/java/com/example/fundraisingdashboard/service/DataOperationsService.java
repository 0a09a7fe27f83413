package com.example.fundraisingdashboard.service;

import com.example.fundraisingdashboard.exception.CommandParseException;
import com.example.fundraisingdashboard.exception.DataOperationException;
import com.example.fundraisingdashboard.exception.StoreAccessException;
import com.example.fundraisingdashboard.exception.UnknownTargetException;
import com.example.fundraisingdashboard.interpreter.CommandInterpreter;
import com.example.fundraisingdashboard.model.BackupSnapshot;
import com.example.fundraisingdashboard.model.ChangeRecord;
import com.example.fundraisingdashboard.model.Command;
import com.example.fundraisingdashboard.model.CommandResult;
import com.example.fundraisingdashboard.model.ExecutionResult;
import com.example.fundraisingdashboard.model.Operation;
import com.example.fundraisingdashboard.model.OperationKind;
import com.example.fundraisingdashboard.model.PendingOperation;
import com.example.fundraisingdashboard.model.PipelineEvent;
import com.example.fundraisingdashboard.model.PipelineStatus;
import com.example.fundraisingdashboard.model.TableName;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Entry point of the change pipeline: classify, gate or execute, record.
 *
 * Every method answers with a {@link CommandResult}; pipeline failures never escape as exceptions.
 * Callers that are not privileged may submit and cancel operations but not confirm them, revert
 * changes or take snapshots.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DataOperationsService {

    private static final Pattern CONFIRMATION_REPLY =
        Pattern.compile("^\\s*(confirm|cancel)\\s+(\\S+)\\s*$", Pattern.CASE_INSENSITIVE);
    private static final int STATUS_RECENT_CHANGES = 5;

    private final CommandInterpreter interpreter;
    private final RiskClassifier classifier;
    private final ConfirmationGate gate;
    private final OperationExecutor executor;
    private final ChangeLedger ledger;
    private final SnapshotManager snapshots;
    private final RevertEngine revertEngine;
    private final PipelineEventLog eventLog;

    // ==================== Commands ====================

    /**
     * Chat entry point: "confirm &lt;id&gt;" and "cancel &lt;id&gt;" resolve pending operations,
     * anything else goes through the command interpreter.
     */
    public CommandResult handleMessage(String text, String actor, boolean privileged) {
        Matcher reply = text != null ? CONFIRMATION_REPLY.matcher(text) : null;
        if (reply != null && reply.matches()) {
            String pendingId = reply.group(2);
            if (reply.group(1).equalsIgnoreCase("cancel")) {
                return cancelOperation(pendingId, actor);
            }
            if (!privileged) {
                return denied(actor, "confirm operations");
            }
            return confirmOperation(pendingId, actor);
        }

        Optional<Command> command;
        try {
            command = interpreter.parse(text);
        } catch (RuntimeException e) {
            log.error("Command interpreter failed: {}", e.getMessage(), e);
            return CommandResult.failure("Could not interpret the request: " + e.getMessage());
        }
        if (command.isEmpty()) {
            return CommandResult.failure("Not a data operation");
        }
        return executeCommand(command.get(), actor, privileged);
    }

    public CommandResult executeCommand(Command command) {
        return executeCommand(command, null, true);
    }

    /**
     * Classify a command and either execute it right away or hold it for confirmation.
     */
    public CommandResult executeCommand(Command command, String actor, boolean privileged) {
        try {
            Operation operation = toOperation(command);
            operation.setRequestedBy(actor);
            eventLog.record(PipelineEvent.EventType.COMMAND_RECEIVED,
                operation.getKind().getValue() + " on " + operation.getTable().getValue(), null, actor);

            switch (operation.getKind()) {
                case REVERT:
                    return privileged
                        ? revertChange(operation.payloadString(Operation.CHANGE_ID), actor)
                        : denied(actor, "revert changes");
                case BACKUP:
                    return privileged
                        ? createSnapshot(operation.payloadString("description"), actor)
                        : denied(actor, "create snapshots");
                case RESTORE:
                    return restoreSnapshot(operation.payloadString(Operation.SNAPSHOT_ID), actor);
                default:
                    break;
            }

            executor.checkSupported(operation);
            classifier.assess(operation);
            if (Boolean.TRUE.equals(command.getRequiresConfirmation())) {
                operation.setRequiresConfirmation(true);
            }

            if (operation.isRequiresConfirmation()) {
                PendingOperation held = gate.hold(operation);
                return CommandResult.pending(held, gate.prompt(held));
            }
            return toResult(executor.execute(operation));
        } catch (RuntimeException e) {
            return failed(e, actor);
        }
    }

    public CommandResult confirmOperation(String pendingId, String actor) {
        try {
            PendingOperation held = gate.confirm(pendingId, actor);
            Operation operation = held.getOperation();
            log.info("Executing confirmed operation {}: {}", pendingId, operation.getDescription());
            return toResult(executor.execute(operation));
        } catch (RuntimeException e) {
            return failed(e, actor);
        }
    }

    public CommandResult cancelOperation(String pendingId, String actor) {
        try {
            PendingOperation held = gate.cancel(pendingId, actor);
            return CommandResult.ok("Operation cancelled: " + held.getOperation().getDescription());
        } catch (RuntimeException e) {
            return failed(e, actor);
        }
    }

    public CommandResult revertChange(String changeId, String actor) {
        try {
            ExecutionResult result = revertEngine.revert(changeId, actor);
            if (result.getChange() == null) {
                CommandResult answer = CommandResult.ok("Change " + changeId + " reverted; its records were already restored");
                answer.setAffectedRecords(0);
                answer.setCanRevert(false);
                return answer;
            }
            if (result.isPartial()) {
                return CommandResult.partial(result.getChange(), result.getFailures(),
                    "Revert of " + changeId + " only partially applied; it can be retried");
            }
            return CommandResult.executed(result.getChange(), "Change " + changeId + " reverted");
        } catch (RuntimeException e) {
            return failed(e, actor);
        }
    }

    // ==================== Snapshots ====================

    public CommandResult createSnapshot(String description, String actor) {
        try {
            String label = description != null && !description.isBlank() ? description : "Manual backup";
            BackupSnapshot snapshot = snapshots.createSnapshot(label);
            CommandResult result = CommandResult.ok("Backup snapshot " + snapshot.getId() + " created");
            result.setSnapshotId(snapshot.getId());
            return result;
        } catch (RuntimeException e) {
            return failed(e, actor);
        }
    }

    /**
     * Restoring is critical: it is always held for confirmation.
     */
    public CommandResult restoreSnapshot(String snapshotId, String actor) {
        try {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(Operation.SNAPSHOT_ID, snapshotId);
            Operation operation = new Operation(OperationKind.RESTORE, TableName.ALL, payload,
                "Restore all tables from snapshot " + snapshotId);
            operation.setRequestedBy(actor);

            executor.checkSupported(operation);
            classifier.assess(operation);
            PendingOperation held = gate.hold(operation);
            CommandResult result = CommandResult.pending(held, gate.prompt(held));
            result.setSnapshotId(snapshotId);
            return result;
        } catch (RuntimeException e) {
            return failed(e, actor);
        }
    }

    // ==================== Status ====================

    public PipelineStatus getStatus() {
        return new PipelineStatus(
            ledger.recent(STATUS_RECENT_CHANGES),
            ledger.revertable(),
            ledger.critical(),
            snapshots.list(),
            gate.pendingIds()
        );
    }

    public List<ChangeRecord> recentChanges(int limit) {
        return ledger.recent(limit);
    }

    public List<PipelineEvent> getEvents() {
        return eventLog.getEvents();
    }

    // ==================== Helpers ====================

    /**
     * Map a command onto an operation. Unknown actions are not data operations; unknown tables
     * are unsupported targets.
     */
    Operation toOperation(Command command) {
        if (command == null) {
            throw new CommandParseException("Not a data operation");
        }
        OperationKind kind = OperationKind.fromAction(command.getAction())
            .orElseThrow(() -> new CommandParseException(
                "Not a data operation: unknown action '" + command.getAction() + "'"));

        Map<String, Object> parameters = command.getParameters() != null
            ? new LinkedHashMap<>(command.getParameters())
            : new LinkedHashMap<>();
        Object tableParameter = parameters.remove("table");

        TableName table;
        switch (kind) {
            case REVERT:
            case BACKUP:
            case RESTORE:
                table = TableName.ALL;
                break;
            case ERASE_ALL:
                table = command.getTarget() == null ? TableName.ALL : resolveTable(command.getTarget(), tableParameter);
                break;
            default:
                table = resolveTable(command.getTarget(), tableParameter);
                break;
        }
        return new Operation(kind, table, parameters, command.getDescription());
    }

    private static TableName resolveTable(String target, Object tableParameter) {
        TableName table = TableName.fromTarget(target)
            .orElseThrow(() -> new UnknownTargetException("Unknown target '" + target + "'"));
        if (table == TableName.ALL && tableParameter != null) {
            String named = String.valueOf(tableParameter);
            table = TableName.fromTarget(named)
                .orElseThrow(() -> new UnknownTargetException("Unknown table '" + named + "'"));
        }
        return table;
    }

    private static CommandResult toResult(ExecutionResult result) {
        ChangeRecord change = result.getChange();
        CommandResult answer;
        if (result.isPartial()) {
            answer = CommandResult.partial(change, result.getFailures(),
                "Applied " + change.getAffectedRecords() + " records, " + result.getFailures().size()
                    + " failed: " + change.getDescription());
        } else {
            answer = CommandResult.executed(change,
                "Done: " + change.getDescription() + " (" + change.getAffectedRecords() + " records)");
        }
        answer.setSnapshotId(result.getBackupSnapshotId());
        return answer;
    }

    private CommandResult denied(String actor, String what) {
        log.warn("{} is not allowed to {}", actor, what);
        eventLog.record(PipelineEvent.EventType.COMMAND_REJECTED, "Not allowed to " + what, null, actor);
        return CommandResult.failure("Only administrators can " + what);
    }

    private CommandResult failed(RuntimeException e, String actor) {
        if (e instanceof CommandParseException) {
            log.debug("Rejected command: {}", e.getMessage());
            eventLog.record(PipelineEvent.EventType.COMMAND_REJECTED, e.getMessage(), null, actor);
        } else if (e instanceof StoreAccessException) {
            log.error("Store rejected the operation: {}", e.getMessage(), e);
            eventLog.record(PipelineEvent.EventType.OPERATION_FAILED, e.getMessage(), null, actor);
        } else if (e instanceof DataOperationException) {
            log.warn("Operation failed: {}", e.getMessage());
            eventLog.record(PipelineEvent.EventType.OPERATION_FAILED, e.getMessage(), null, actor);
        } else {
            log.error("Unexpected failure in data pipeline: {}", e.getMessage(), e);
            eventLog.record(PipelineEvent.EventType.OPERATION_FAILED, e.getMessage(), null, actor);
        }
        return CommandResult.failure(e.getMessage());
    }
}
