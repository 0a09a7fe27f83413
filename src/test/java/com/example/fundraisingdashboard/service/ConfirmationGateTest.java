package com.example.fundraisingdashboard.service;

import com.example.fundraisingdashboard.config.PipelineConfig;
import com.example.fundraisingdashboard.exception.ConfirmationMissException;
import com.example.fundraisingdashboard.model.Operation;
import com.example.fundraisingdashboard.model.OperationKind;
import com.example.fundraisingdashboard.model.PendingOperation;
import com.example.fundraisingdashboard.model.PipelineEvent;
import com.example.fundraisingdashboard.model.RiskTier;
import com.example.fundraisingdashboard.model.TableName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConfirmationGateTest {

    private MutableClock clock;
    private PipelineEventLog eventLog;
    private ConfirmationGate gate;

    @BeforeEach
    void setUp() {
        PipelineConfig config = new PipelineConfig();
        clock = new MutableClock(Instant.parse("2024-06-01T10:00:00Z"));
        eventLog = new PipelineEventLog(config, clock);
        gate = new ConfirmationGate(config, eventLog, clock);
    }

    @Test
    void testHoldAndConfirm() {
        PendingOperation held = gate.hold(eraseAll());

        assertTrue(held.getId().startsWith("pending-"));
        assertEquals(Instant.parse("2024-06-01T10:05:00Z"), held.getExpiresAt());
        assertEquals(List.of(held.getId()), gate.pendingIds());

        PendingOperation confirmed = gate.confirm(held.getId(), "admin");

        assertSame(held, confirmed);
        assertTrue(gate.pendingIds().isEmpty());
    }

    @Test
    void testPromptNamesIdTierAndTable() {
        PendingOperation held = gate.hold(eraseAll());

        String prompt = gate.prompt(held);

        assertTrue(prompt.contains(held.getId()));
        assertTrue(prompt.contains("CRITICAL"));
        assertTrue(prompt.contains("erase_all on all"));
        assertTrue(prompt.contains("Erase everything"));
        assertTrue(prompt.contains("cancel " + held.getId()));
        assertTrue(prompt.contains("5 minutes"));
    }

    @Test
    void testPromptIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            PendingOperation held = gate.hold(eraseAll());

            assertTrue(gate.prompt(held).contains("This is a CRITICAL risk operation"));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void testIdsAreNeverReused() {
        PendingOperation first = gate.hold(eraseAll());
        gate.cancel(first.getId(), "admin");
        PendingOperation second = gate.hold(eraseAll());

        assertNotEquals(first.getId(), second.getId());
    }

    @Test
    void testUnknownIdIsMiss() {
        ConfirmationMissException e = assertThrows(ConfirmationMissException.class,
            () -> gate.confirm("pending-unknown", "admin"));
        assertTrue(e.getMessage().contains("No pending operation found"));
        assertThrows(ConfirmationMissException.class, () -> gate.cancel("pending-unknown", "admin"));
    }

    @Test
    void testCancelledCannotBeConfirmed() {
        PendingOperation held = gate.hold(eraseAll());

        gate.cancel(held.getId(), "admin");

        assertThrows(ConfirmationMissException.class, () -> gate.confirm(held.getId(), "admin"));
    }

    @Test
    void testExpiredCannotBeConfirmed() {
        PendingOperation held = gate.hold(eraseAll());

        clock.advance(Duration.ofMinutes(5));

        assertTrue(gate.pendingIds().isEmpty());
        assertThrows(ConfirmationMissException.class, () -> gate.confirm(held.getId(), "admin"));
        assertThrows(ConfirmationMissException.class, () -> gate.confirm(held.getId(), "admin"));
    }

    @Test
    void testSweepPurgesExpired() {
        PendingOperation old = gate.hold(eraseAll());
        clock.advance(Duration.ofMinutes(4));
        PendingOperation recent = gate.hold(eraseAll());
        clock.advance(Duration.ofMinutes(2));

        gate.purgeExpired();

        assertEquals(List.of(recent.getId()), gate.pendingIds());
        assertThrows(ConfirmationMissException.class, () -> gate.confirm(old.getId(), "admin"));
        assertTrue(eventLog.getEvents().stream()
            .anyMatch(e -> e.getType() == PipelineEvent.EventType.OPERATION_EXPIRED
                && old.getId().equals(e.getSubjectId())));
    }

    @Test
    void testConcurrentConfirmations_OnlyOneWins() throws Exception {
        PendingOperation held = gate.hold(eraseAll());
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        for (int i = 0; i < threads; i++) {
            results.add(pool.submit(() -> {
                start.await();
                try {
                    gate.confirm(held.getId(), "admin");
                    return true;
                } catch (ConfirmationMissException e) {
                    return false;
                }
            }));
        }
        start.countDown();

        int winners = 0;
        for (Future<Boolean> result : results) {
            if (result.get(5, TimeUnit.SECONDS)) {
                winners++;
            }
        }
        pool.shutdown();

        assertEquals(1, winners);
    }

    private static Operation eraseAll() {
        Operation op = new Operation(OperationKind.ERASE_ALL, TableName.ALL, new HashMap<>(), "Erase everything");
        op.setRiskTier(RiskTier.CRITICAL);
        op.setRequiresConfirmation(true);
        return op;
    }
}
