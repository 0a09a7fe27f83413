package com.example.fundraisingdashboard.service;

import com.example.fundraisingdashboard.config.PipelineConfig;
import com.example.fundraisingdashboard.model.PipelineEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;

/**
 * Bounded, in-memory trail of what the pipeline did, newest last.
 */
@Slf4j
@Component
public class PipelineEventLog {

    private final List<PipelineEvent> events = new LinkedList<>();
    private final PipelineConfig config;
    private final Clock clock;

    public PipelineEventLog(PipelineConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public void record(PipelineEvent.EventType type, String description, String subjectId, String actor) {
        PipelineEvent event = new PipelineEvent(
            LocalDateTime.now(clock),
            type,
            description,
            subjectId,
            actor
        );

        synchronized (events) {
            events.add(event);
            while (events.size() > config.getMaxEvents()) {
                events.remove(0);
            }
        }

        log.info("[EVENT] {}", event.toLogString());
    }

    public List<PipelineEvent> getEvents() {
        synchronized (events) {
            return new ArrayList<>(events);
        }
    }
}
