package com.example.fundraisingdashboard.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PipelineEvent model.
 */
class PipelineEventTest {

    @Test
    void testEventCreation() {
        LocalDateTime now = LocalDateTime.now();
        PipelineEvent event = new PipelineEvent(
            now,
            PipelineEvent.EventType.OPERATION_GATED,
            "critical erase_all on all awaiting confirmation",
            "pending-1",
            "admin"
        );

        assertEquals(now, event.getTimestamp());
        assertEquals(PipelineEvent.EventType.OPERATION_GATED, event.getType());
        assertEquals("pending-1", event.getSubjectId());
        assertEquals("admin", event.getActor());
    }

    @Test
    void testToLogString() {
        PipelineEvent event = new PipelineEvent(
            LocalDateTime.of(2024, 6, 1, 10, 15, 30, 123_000_000),
            PipelineEvent.EventType.CHANGE_REVERTED,
            "Reverted delete on prospects",
            "change-1",
            "admin"
        );

        assertEquals("[10:15:30.123] CHANGE_REVERTED (change-1): Reverted delete on prospects", event.toLogString());
    }

    @Test
    void testToLogStringWithoutSubject() {
        PipelineEvent event = new PipelineEvent(
            LocalDateTime.of(2024, 6, 1, 10, 0),
            PipelineEvent.EventType.COMMAND_REJECTED,
            "Not a data operation",
            null,
            null
        );

        assertTrue(event.toLogString().contains("(-)"));
    }
}
