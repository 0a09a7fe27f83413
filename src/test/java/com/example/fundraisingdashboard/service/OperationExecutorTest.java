package com.example.fundraisingdashboard.service;

import com.example.fundraisingdashboard.exception.OperationFailedException;
import com.example.fundraisingdashboard.exception.UnknownTargetException;
import com.example.fundraisingdashboard.model.BackupSnapshot;
import com.example.fundraisingdashboard.model.ChangeRecord;
import com.example.fundraisingdashboard.model.ExecutionResult;
import com.example.fundraisingdashboard.model.Operation;
import com.example.fundraisingdashboard.model.OperationKind;
import com.example.fundraisingdashboard.model.TableName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OperationExecutorTest {

    private PipelineFixture fixture;
    private OperationExecutor executor;

    @BeforeEach
    void setUp() {
        fixture = new PipelineFixture();
        fixture.seedProspects();
        executor = fixture.executor;
    }

    @Test
    void testUpdateCapturesBeforeState() {
        ExecutionResult result = executor.execute(operation(OperationKind.UPDATE, TableName.PROSPECTS,
            Map.of("id", "P010", "probability", 0.9)));

        ChangeRecord change = result.getChange();
        assertEquals(1, change.getAffectedRecords());
        assertEquals("0.8", change.getBeforeData().get(0).get("probability"));
        assertEquals("0.9", change.getAfterData().get(0).get("probability"));
        assertEquals("0.9", fixture.find(TableName.PROSPECTS, "P010").get("probability"));
        assertNull(result.getBackupSnapshotId());
    }

    @Test
    void testInvalidValueRejected() {
        assertThrows(OperationFailedException.class, () -> executor.execute(operation(OperationKind.UPDATE,
            TableName.PROSPECTS, Map.of("id", "P010", "probability", 1.5))));

        assertEquals("0.8", fixture.find(TableName.PROSPECTS, "P010").get("probability"));
        assertEquals(0, fixture.ledger.size());
    }

    @Test
    void testDuplicateCreateRejected() {
        OperationFailedException e = assertThrows(OperationFailedException.class,
            () -> executor.execute(operation(OperationKind.CREATE, TableName.PROSPECTS,
                Map.of("id", "P009", "funderName", "Someone"))));

        assertTrue(e.getMessage().contains("already exists"));
    }

    @Test
    void testBulkCreateAppliesEachRecord() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("records", List.of(
            Map.of("stateCode", "KA", "fiscalYear", "FY24-25", "targetAmount", 1000000),
            Map.of("stateCode", "TN", "fiscalYear", "FY24-25", "targetAmount", 750000)));

        ExecutionResult result = executor.execute(new Operation(OperationKind.BULK_CREATE, TableName.TARGETS, payload, null));

        assertEquals(2, result.getChange().getAffectedRecords());
        assertNotNull(result.getBackupSnapshotId());
        assertEquals(2, fixture.live(TableName.TARGETS).size());
        assertEquals(List.of(Map.of("stateCode", "KA", "fiscalYear", "FY24-25"),
                Map.of("stateCode", "TN", "fiscalYear", "FY24-25")),
            result.getChange().getRevertData());
    }

    @Test
    void testDeleteAllOfOneTable() {
        ExecutionResult result = executor.execute(operation(OperationKind.BULK_DELETE, TableName.PROSPECTS,
            Map.of("all", true)));

        assertEquals(3, result.getChange().getAffectedRecords());
        assertTrue(fixture.live(TableName.PROSPECTS).isEmpty());
        assertEquals(3, fixture.store.getRows(TableName.PROSPECTS).size());
        assertTrue(result.getChange().isCanRevert());
    }

    @Test
    void testUnsupportedTargets() {
        assertThrows(UnknownTargetException.class,
            () -> executor.execute(operation(OperationKind.CREATE, TableName.ALL, Map.of("id", "x"))));
        assertThrows(UnknownTargetException.class,
            () -> executor.execute(operation(OperationKind.UPDATE, TableName.STATES, Map.of("code", "KA"))));
        assertThrows(UnknownTargetException.class,
            () -> executor.execute(operation(OperationKind.UPDATE, TableName.SCHOOLS, Map.of("all", true))));
        assertThrows(OperationFailedException.class,
            () -> executor.execute(operation(OperationKind.CREATE, TableName.SCHOOLS, Map.of())));
        assertTrue(fixture.snapshots.list().isEmpty());
    }

    @Test
    void testRestoreOverwritesEveryTable() {
        BackupSnapshot before = fixture.snapshots.createSnapshot("baseline");
        executor.execute(operation(OperationKind.DELETE, TableName.PROSPECTS, Map.of("id", "P008")));
        executor.execute(operation(OperationKind.CREATE, TableName.SCHOOLS, Map.of("name", "New School")));

        ExecutionResult result = executor.execute(operation(OperationKind.RESTORE, TableName.ALL,
            Map.of("snapshotId", before.getId())));

        assertEquals(2, result.getChange().getAffectedRecords());
        assertNotNull(fixture.find(TableName.PROSPECTS, "P008"));
        assertTrue(fixture.live(TableName.SCHOOLS).isEmpty());
        assertFalse(result.getChange().isCanRevert());
        assertTrue(result.getChange().getDescription().contains(before.getId()));
        assertNotNull(result.getBackupSnapshotId());
    }

    private static Operation operation(OperationKind kind, TableName table, Map<String, Object> payload) {
        return new Operation(kind, table, new HashMap<>(payload), null);
    }
}
