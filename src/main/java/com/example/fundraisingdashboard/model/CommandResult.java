package com.example.fundraisingdashboard.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured answer of the pipeline boundary. Nothing thrown inside the pipeline escapes;
 * it ends up here with {@code success=false}.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CommandResult {
    private boolean success;
    private String message;
    private String changeId;
    private String pendingId;
    private String snapshotId;
    private Integer affectedRecords;
    private Boolean canRevert;
    private Boolean confirmationRequired;
    private Boolean partial;
    private List<String> failures;

    public static CommandResult ok(String message) {
        CommandResult result = new CommandResult();
        result.setSuccess(true);
        result.setMessage(message);
        return result;
    }

    public static CommandResult failure(String message) {
        CommandResult result = new CommandResult();
        result.setSuccess(false);
        result.setMessage(message);
        return result;
    }

    public static CommandResult executed(ChangeRecord change, String message) {
        CommandResult result = ok(message);
        result.setChangeId(change.getId());
        result.setAffectedRecords(change.getAffectedRecords());
        result.setCanRevert(change.isCanRevert());
        return result;
    }

    public static CommandResult partial(ChangeRecord change, List<String> failures, String message) {
        CommandResult result = executed(change, message);
        result.setSuccess(false);
        result.setPartial(true);
        result.setFailures(new ArrayList<>(failures));
        return result;
    }

    public static CommandResult pending(PendingOperation pending, String prompt) {
        CommandResult result = ok(prompt);
        result.setPendingId(pending.getId());
        result.setConfirmationRequired(true);
        result.setCanRevert(false);
        return result;
    }
}
