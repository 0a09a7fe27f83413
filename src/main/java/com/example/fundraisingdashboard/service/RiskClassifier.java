package com.example.fundraisingdashboard.service;

import com.example.fundraisingdashboard.model.Operation;
import com.example.fundraisingdashboard.model.OperationKind;
import com.example.fundraisingdashboard.model.RiskTier;
import com.example.fundraisingdashboard.model.TableName;
import org.springframework.stereotype.Component;

/**
 * Assigns a risk tier to an operation from its kind, target table and payload size.
 * Pure: no I/O, no state.
 */
@Component
public class RiskClassifier {

    /**
     * Rules are evaluated top to bottom; the first match wins.
     */
    public RiskTier classify(Operation operation) {
        OperationKind kind = operation.getKind();
        if (kind == OperationKind.BACKUP) {
            return RiskTier.LOW;
        }
        if (kind == OperationKind.REVERT) {
            return RiskTier.MEDIUM;
        }
        if (kind == OperationKind.ERASE_ALL || kind == OperationKind.RESTORE
            || operation.getTable() == TableName.ALL) {
            return RiskTier.CRITICAL;
        }
        if (kind.isBulk()) {
            return RiskTier.HIGH;
        }
        if (kind == OperationKind.DELETE && (operation.selectsAll() || operation.payloadSize() > 1)) {
            return RiskTier.HIGH;
        }
        if (kind == OperationKind.UPDATE || kind == OperationKind.DELETE) {
            return RiskTier.MEDIUM;
        }
        return RiskTier.LOW;
    }

    /**
     * Whether the operation must be held for explicit confirmation.
     * Erase-all and restore always are; reverts and backups never are.
     */
    public boolean requiresConfirmation(Operation operation, RiskTier tier) {
        OperationKind kind = operation.getKind();
        if (kind == OperationKind.ERASE_ALL || kind == OperationKind.RESTORE) {
            return true;
        }
        if (kind == OperationKind.REVERT || kind == OperationKind.BACKUP) {
            return false;
        }
        return tier.atLeast(RiskTier.MEDIUM);
    }

    /**
     * Classify the operation and record the verdict on it.
     */
    public Operation assess(Operation operation) {
        RiskTier tier = classify(operation);
        operation.setRiskTier(tier);
        operation.setRequiresConfirmation(requiresConfirmation(operation, tier));
        return operation;
    }
}
