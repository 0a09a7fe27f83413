package com.example.fundraisingdashboard.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

@Data
@AllArgsConstructor
public class PipelineEvent {
    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    private LocalDateTime timestamp;
    private EventType type;
    private String description;
    private String subjectId;
    private String actor;

    public enum EventType {
        COMMAND_RECEIVED,
        COMMAND_REJECTED,
        OPERATION_GATED,
        OPERATION_CONFIRMED,
        OPERATION_CANCELLED,
        OPERATION_EXPIRED,
        OPERATION_EXECUTED,
        OPERATION_PARTIAL,
        OPERATION_FAILED,
        CHANGE_REVERTED,
        SNAPSHOT_CREATED,
        SNAPSHOT_RESTORED
    }

    public String getFormattedTimestamp() {
        return timestamp.format(FORMATTER);
    }

    public String toLogString() {
        return String.format("[%s] %s (%s): %s",
            getFormattedTimestamp(),
            type,
            subjectId != null ? subjectId : "-",
            description);
    }
}
