package com.example.fundraisingdashboard.service;

import com.example.fundraisingdashboard.exception.RevertIneligibleException;
import com.example.fundraisingdashboard.exception.StoreAccessException;
import com.example.fundraisingdashboard.model.ChangeRecord;
import com.example.fundraisingdashboard.model.ExecutionResult;
import com.example.fundraisingdashboard.model.Operation;
import com.example.fundraisingdashboard.model.OperationKind;
import com.example.fundraisingdashboard.model.RiskTier;
import com.example.fundraisingdashboard.model.TableName;
import com.example.fundraisingdashboard.store.TabularStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RevertEngineTest {

    @Mock
    private ChangeLedger ledger;

    @Mock
    private SnapshotManager snapshots;

    @Mock
    private OperationExecutor executor;

    @Mock
    private PipelineEventLog eventLog;

    @Mock
    private TabularStore store;

    @InjectMocks
    private RevertEngine revertEngine;

    @Test
    void testRevertSnapshotsThenExecutesInverse() {
        ChangeRecord original = change(OperationKind.BULK_CREATE, List.of(Map.of("id", "S1"), Map.of("id", "S2")));
        ChangeRecord inverseRecord = change(OperationKind.REVERT, List.of());
        when(ledger.beginRevert("change-1")).thenReturn(original);
        when(store.getRows(TableName.SCHOOLS)).thenReturn(List.of(
            List.of("S1", "KA", "Sunrise", "STEM"), List.of("S2", "TN", "Lotus", "Arts")));
        when(executor.execute(any())).thenReturn(new ExecutionResult(inverseRecord, List.of(), null));

        ExecutionResult result = revertEngine.revert("change-1", "admin");

        assertSame(inverseRecord, result.getChange());
        InOrder order = inOrder(snapshots, executor, ledger);
        order.verify(snapshots).createSnapshot("Auto-backup before reverting change-1");
        order.verify(executor).execute(any());
        order.verify(ledger).completeRevert("change-1");
        verify(ledger, never()).abortRevert(anyString());

        ArgumentCaptor<Operation> captor = ArgumentCaptor.forClass(Operation.class);
        verify(executor).execute(captor.capture());
        Operation inverse = captor.getValue();
        assertEquals(OperationKind.BULK_DELETE, inverse.getKind());
        assertEquals(TableName.SCHOOLS, inverse.getTable());
        assertEquals(2, inverse.records().size());
        assertEquals("change-1", inverse.getRevertOf());
        assertEquals(RiskTier.MEDIUM, inverse.getRiskTier());
        assertEquals("admin", inverse.getRequestedBy());
    }

    @Test
    void testFailedInverseLeavesOriginalRevertable() {
        when(ledger.beginRevert("change-1")).thenReturn(change(OperationKind.UPDATE, List.of(Map.of("id", "S1"))));
        when(executor.execute(any())).thenThrow(new StoreAccessException("network down"));

        assertThrows(StoreAccessException.class, () -> revertEngine.revert("change-1", "admin"));

        verify(ledger).abortRevert("change-1");
        verify(ledger, never()).completeRevert(anyString());
    }

    @Test
    void testPartialInverseLeavesOriginalRevertable() {
        when(ledger.beginRevert("change-1")).thenReturn(change(OperationKind.BULK_DELETE,
            List.of(Map.of("id", "S1"), Map.of("id", "S2"))));
        when(executor.execute(any())).thenReturn(new ExecutionResult(change(OperationKind.REVERT, List.of()),
            List.of("schools record S2 already exists"), null));

        ExecutionResult result = revertEngine.revert("change-1", "admin");

        assertTrue(result.isPartial());
        verify(ledger).abortRevert("change-1");
        verify(ledger, never()).completeRevert(anyString());
    }

    @Test
    void testRetryOnlyAppliesOutstandingRecords() {
        when(ledger.beginRevert("change-1")).thenReturn(change(OperationKind.BULK_CREATE,
            List.of(Map.of("id", "S1"), Map.of("id", "S2"))));
        when(store.getRows(TableName.SCHOOLS)).thenReturn(List.of(
            List.of("", "", "", ""), List.of("S2", "TN", "Lotus", "Arts")));
        when(executor.execute(any())).thenReturn(new ExecutionResult(change(OperationKind.REVERT, List.of()), List.of(), null));

        revertEngine.revert("change-1", "admin");

        ArgumentCaptor<Operation> captor = ArgumentCaptor.forClass(Operation.class);
        verify(executor).execute(captor.capture());
        assertEquals(List.of(Map.of("id", "S2")), captor.getValue().records());
        verify(ledger).completeRevert("change-1");
    }

    @Test
    void testNothingOutstandingCompletesWithoutWriting() {
        when(ledger.beginRevert("change-1")).thenReturn(change(OperationKind.UPDATE,
            List.of(Map.of("id", "S1", "name", "Sunrise"))));
        when(store.getRows(TableName.SCHOOLS)).thenReturn(List.of(List.of("S1", "KA", "Sunrise", "STEM")));

        ExecutionResult result = revertEngine.revert("change-1", "admin");

        assertNull(result.getChange());
        assertFalse(result.isPartial());
        verify(ledger).completeRevert("change-1");
        verify(ledger, never()).abortRevert(anyString());
        verifyNoInteractions(snapshots, executor);
    }

    @Test
    void testIneligibleChangeTakesNoSnapshot() {
        when(ledger.beginRevert("change-1")).thenThrow(new RevertIneligibleException("Change change-1 cannot be reverted"));

        assertThrows(RevertIneligibleException.class, () -> revertEngine.revert("change-1", "admin"));

        verifyNoInteractions(snapshots, executor);
    }

    @Test
    void testInverseKinds() {
        List<Map<String, String>> data = List.of(Map.of("id", "S1", "name", "Sunrise"));

        assertEquals(OperationKind.DELETE, revertEngine.inverseOf(change(OperationKind.CREATE, data)).getKind());
        assertEquals(OperationKind.UPDATE, revertEngine.inverseOf(change(OperationKind.UPDATE, data)).getKind());
        assertEquals(OperationKind.CREATE, revertEngine.inverseOf(change(OperationKind.DELETE, data)).getKind());
        assertEquals(OperationKind.BULK_UPDATE, revertEngine.inverseOf(change(OperationKind.BULK_UPDATE, data)).getKind());
        assertEquals(OperationKind.BULK_CREATE, revertEngine.inverseOf(change(OperationKind.BULK_DELETE, data)).getKind());
        assertThrows(RevertIneligibleException.class,
            () -> revertEngine.inverseOf(change(OperationKind.ERASE_ALL, data)));
        assertThrows(RevertIneligibleException.class,
            () -> revertEngine.inverseOf(change(OperationKind.CREATE, List.of())));
    }

    private static ChangeRecord change(OperationKind kind, List<Map<String, String>> revertData) {
        return ChangeRecord.builder()
            .id("change-1")
            .timestamp(Instant.parse("2024-06-01T10:00:00Z"))
            .operationKind(kind)
            .table(TableName.SCHOOLS)
            .description("test change")
            .revertData(revertData)
            .affectedRecords(revertData.size())
            .canRevert(true)
            .build();
    }
}
