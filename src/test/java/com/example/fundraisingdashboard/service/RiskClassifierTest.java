package com.example.fundraisingdashboard.service;

import com.example.fundraisingdashboard.model.Operation;
import com.example.fundraisingdashboard.model.OperationKind;
import com.example.fundraisingdashboard.model.RiskTier;
import com.example.fundraisingdashboard.model.TableName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RiskClassifierTest {

    private final RiskClassifier classifier = new RiskClassifier();

    @Test
    void testCreateIsLowAndNotGated() {
        Operation op = operation(OperationKind.CREATE, TableName.CONTRIBUTIONS, Map.of("amount", 50000));

        assertEquals(RiskTier.LOW, classifier.classify(op));
        assertFalse(classifier.requiresConfirmation(op, RiskTier.LOW));
    }

    @Test
    void testUpdateAndSingleDeleteAreMedium() {
        assertEquals(RiskTier.MEDIUM,
            classifier.classify(operation(OperationKind.UPDATE, TableName.PROSPECTS, Map.of("id", "P009", "stage", "Won"))));
        assertEquals(RiskTier.MEDIUM,
            classifier.classify(operation(OperationKind.DELETE, TableName.PROSPECTS, Map.of("id", "P009"))));
    }

    @Test
    void testDeleteMatchingSeveralRecordsIsHigh() {
        Operation byIds = operation(OperationKind.DELETE, TableName.PROSPECTS, Map.of("ids", List.of("P1", "P2")));
        Operation all = operation(OperationKind.DELETE, TableName.SCHOOLS, Map.of("all", true));

        assertEquals(RiskTier.HIGH, classifier.classify(byIds));
        assertEquals(RiskTier.HIGH, classifier.classify(all));
    }

    @Test
    void testBulkKindsAreHigh() {
        Map<String, Object> one = Map.of("records", List.of(Map.of("id", "S1", "name", "A")));

        assertEquals(RiskTier.HIGH, classifier.classify(operation(OperationKind.BULK_CREATE, TableName.SCHOOLS, one)));
        assertEquals(RiskTier.HIGH, classifier.classify(operation(OperationKind.BULK_UPDATE, TableName.SCHOOLS, one)));
        assertEquals(RiskTier.HIGH, classifier.classify(operation(OperationKind.BULK_DELETE, TableName.SCHOOLS, one)));
    }

    @Test
    void testDatabaseWideOperationsAreCritical() {
        assertEquals(RiskTier.CRITICAL, classifier.classify(operation(OperationKind.ERASE_ALL, TableName.ALL, Map.of())));
        assertEquals(RiskTier.CRITICAL,
            classifier.classify(operation(OperationKind.ERASE_ALL, TableName.PROSPECTS, Map.of())));
        assertEquals(RiskTier.CRITICAL,
            classifier.classify(operation(OperationKind.RESTORE, TableName.ALL, Map.of("snapshotId", "s"))));
        assertEquals(RiskTier.CRITICAL,
            classifier.classify(operation(OperationKind.UPDATE, TableName.ALL, Map.of("id", "x"))));
    }

    @Test
    void testBackupAndRevertNeverGated() {
        Operation backup = operation(OperationKind.BACKUP, TableName.ALL, Map.of());
        Operation revert = operation(OperationKind.REVERT, TableName.ALL, Map.of("changeId", "c"));

        assertEquals(RiskTier.LOW, classifier.classify(backup));
        assertEquals(RiskTier.MEDIUM, classifier.classify(revert));
        assertFalse(classifier.requiresConfirmation(backup, RiskTier.LOW));
        assertFalse(classifier.requiresConfirmation(revert, RiskTier.MEDIUM));
    }

    @Test
    void testEraseAndRestoreAlwaysGated() {
        Operation erase = operation(OperationKind.ERASE_ALL, TableName.ALL, Map.of());
        Operation restore = operation(OperationKind.RESTORE, TableName.ALL, Map.of("snapshotId", "s"));

        assertTrue(classifier.requiresConfirmation(erase, RiskTier.LOW));
        assertTrue(classifier.requiresConfirmation(restore, RiskTier.LOW));
    }

    @Test
    void testClassificationIsDeterministic() {
        Operation first = operation(OperationKind.DELETE, TableName.PROSPECTS, Map.of("id", "P009"));
        Operation second = operation(OperationKind.DELETE, TableName.PROSPECTS, Map.of("id", "P010"));

        RiskTier tier = classifier.classify(first);
        for (int i = 0; i < 10; i++) {
            assertEquals(tier, classifier.classify(first));
            assertEquals(tier, classifier.classify(second));
        }
    }

    @Test
    void testAssessSetsVerdict() {
        Operation op = classifier.assess(operation(OperationKind.UPDATE, TableName.USERS, Map.of("id", "u1", "role", "admin")));

        assertEquals(RiskTier.MEDIUM, op.getRiskTier());
        assertTrue(op.isRequiresConfirmation());
    }

    private static Operation operation(OperationKind kind, TableName table, Map<String, Object> payload) {
        return new Operation(kind, table, new HashMap<>(payload), null);
    }
}
