package com.example.fundraisingdashboard.service;

import com.example.fundraisingdashboard.config.PipelineConfig;
import com.example.fundraisingdashboard.model.PipelineEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PipelineEventLogTest {

    private MutableClock clock;
    private PipelineEventLog eventLog;

    @BeforeEach
    void setUp() {
        PipelineConfig config = new PipelineConfig();
        config.setMaxEvents(3);
        clock = new MutableClock(Instant.parse("2024-06-01T10:00:00Z"));
        eventLog = new PipelineEventLog(config, clock);
    }

    @Test
    void testTimestampsFollowClock() {
        eventLog.record(PipelineEvent.EventType.COMMAND_RECEIVED, "create on schools", null, "admin");
        clock.advance(Duration.ofMinutes(2));
        eventLog.record(PipelineEvent.EventType.OPERATION_EXECUTED, "create on schools", "change-1", "admin");

        List<PipelineEvent> events = eventLog.getEvents();

        assertEquals(LocalDateTime.now(clock).minusMinutes(2), events.get(0).getTimestamp());
        assertEquals(LocalDateTime.now(clock), events.get(1).getTimestamp());
    }

    @Test
    void testOldestEventsAreDropped() {
        for (int i = 1; i <= 5; i++) {
            eventLog.record(PipelineEvent.EventType.OPERATION_EXECUTED, "change " + i, "change-" + i, null);
        }

        List<PipelineEvent> events = eventLog.getEvents();

        assertEquals(3, events.size());
        assertEquals("change-3", events.get(0).getSubjectId());
        assertEquals("change-5", events.get(2).getSubjectId());
    }
}
