package com.example.fundraisingdashboard.service;

import com.example.fundraisingdashboard.config.PipelineConfig;
import com.example.fundraisingdashboard.exception.ConfirmationMissException;
import com.example.fundraisingdashboard.model.Operation;
import com.example.fundraisingdashboard.model.PendingOperation;
import com.example.fundraisingdashboard.model.PipelineEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds operations that need explicit approval.
 *
 * A pending operation leaves the gate exactly once: confirmed, cancelled or expired. Removal is
 * atomic, so two concurrent confirmations of the same id cannot both obtain the operation.
 * Expiry is checked on access and by a periodic sweep.
 */
@Slf4j
@Service
public class ConfirmationGate {

    private final Map<String, PendingOperation> pending = new ConcurrentHashMap<>();
    private final PipelineConfig config;
    private final PipelineEventLog eventLog;
    private final Clock clock;

    public ConfirmationGate(PipelineConfig config, PipelineEventLog eventLog, Clock clock) {
        this.config = config;
        this.eventLog = eventLog;
        this.clock = clock;
    }

    /**
     * Park the operation under a fresh id.
     */
    public PendingOperation hold(Operation operation) {
        Instant now = clock.instant();
        String id = "pending-" + UUID.randomUUID();
        PendingOperation held = new PendingOperation(id, operation, now, now.plus(config.getConfirmationTtl()));
        pending.put(id, held);

        eventLog.record(PipelineEvent.EventType.OPERATION_GATED,
            operation.getRiskTier().getValue() + " " + operation.getKind().getValue()
                + " on " + operation.getTable().getValue() + " awaiting confirmation",
            id, operation.getRequestedBy());
        return held;
    }

    /**
     * Human readable prompt for a held operation.
     */
    public String prompt(PendingOperation held) {
        Operation operation = held.getOperation();
        long minutes = Math.max(1, Duration.between(held.getCreatedAt(), held.getExpiresAt()).toMinutes());
        return "This is a " + operation.getRiskTier().getValue().toUpperCase(Locale.ROOT) + " risk operation"
            + " (" + operation.getKind().getValue() + " on " + operation.getTable().getValue() + "): "
            + operation.getDescription() + ". "
            + "Reply 'confirm " + held.getId() + "' to proceed or 'cancel " + held.getId() + "' to abort. "
            + "The request expires in " + minutes + " minute" + (minutes == 1 ? "" : "s") + ".";
    }

    /**
     * Remove and return the pending operation for execution.
     *
     * @throws ConfirmationMissException if the id is unknown, already resolved or expired
     */
    public PendingOperation confirm(String pendingId, String actor) {
        PendingOperation held = take(pendingId);
        eventLog.record(PipelineEvent.EventType.OPERATION_CONFIRMED,
            "Confirmed " + held.getOperation().getKind().getValue() + " on "
                + held.getOperation().getTable().getValue(),
            pendingId, actor);
        return held;
    }

    /**
     * Drop the pending operation without executing it.
     *
     * @throws ConfirmationMissException if the id is unknown, already resolved or expired
     */
    public PendingOperation cancel(String pendingId, String actor) {
        PendingOperation held = take(pendingId);
        eventLog.record(PipelineEvent.EventType.OPERATION_CANCELLED,
            "Cancelled " + held.getOperation().getKind().getValue() + " on "
                + held.getOperation().getTable().getValue(),
            pendingId, actor);
        return held;
    }

    /**
     * Ids of operations still awaiting a decision, oldest first.
     */
    public List<String> pendingIds() {
        Instant now = clock.instant();
        List<PendingOperation> live = new ArrayList<>();
        for (PendingOperation held : pending.values()) {
            if (!held.isExpired(now)) {
                live.add(held);
            }
        }
        live.sort(Comparator.comparing(PendingOperation::getCreatedAt));
        List<String> ids = new ArrayList<>();
        for (PendingOperation held : live) {
            ids.add(held.getId());
        }
        return ids;
    }

    @Scheduled(fixedDelayString = "${pipeline.confirmation-sweep-interval-ms:60000}")
    public void purgeExpired() {
        Instant now = clock.instant();
        for (PendingOperation held : new ArrayList<>(pending.values())) {
            if (held.isExpired(now) && pending.remove(held.getId(), held)) {
                expired(held);
            }
        }
    }

    private PendingOperation take(String pendingId) {
        PendingOperation held = pendingId != null ? pending.remove(pendingId) : null;
        if (held == null) {
            throw new ConfirmationMissException("No pending operation found with ID: " + pendingId);
        }
        if (held.isExpired(clock.instant())) {
            expired(held);
            throw new ConfirmationMissException("Pending operation " + pendingId + " has expired");
        }
        return held;
    }

    private void expired(PendingOperation held) {
        log.info("Pending operation {} expired at {}", held.getId(), held.getExpiresAt());
        eventLog.record(PipelineEvent.EventType.OPERATION_EXPIRED,
            "Expired without confirmation: " + held.getOperation().getDescription(),
            held.getId(), held.getOperation().getRequestedBy());
    }
}
