package com.example.fundraisingdashboard.service;

import com.example.fundraisingdashboard.config.PipelineConfig;
import com.example.fundraisingdashboard.exception.RevertIneligibleException;
import com.example.fundraisingdashboard.model.ChangeRecord;
import com.example.fundraisingdashboard.model.OperationKind;
import com.example.fundraisingdashboard.persistence.ChangeHistoryPersistenceService;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Bounded history of executed changes, oldest evicted first.
 *
 * Each entry is mirrored to the database. A failing mirror write is logged and does not
 * undo the change, which has already been applied to the store.
 */
@Slf4j
@Service
public class ChangeLedger {

    private static final Set<OperationKind> CRITICAL_KINDS = EnumSet.of(
        OperationKind.BULK_DELETE, OperationKind.BULK_UPDATE, OperationKind.ERASE_ALL, OperationKind.RESTORE);

    private final Deque<ChangeRecord> changes = new ArrayDeque<>();
    private final Set<String> revertsInFlight = new HashSet<>();
    private final PipelineConfig config;
    private final ChangeHistoryPersistenceService persistence;

    public ChangeLedger(PipelineConfig config, ChangeHistoryPersistenceService persistence) {
        this.config = config;
        this.persistence = persistence;
    }

    @PostConstruct
    public void loadPersisted() {
        List<ChangeRecord> persisted;
        try {
            persisted = persistence.loadChanges(config.getMaxChanges());
        } catch (RuntimeException e) {
            log.error("Could not load change history, starting empty: {}", e.getMessage(), e);
            return;
        }
        synchronized (changes) {
            for (ChangeRecord change : persisted) {
                changes.addFirst(change);
            }
        }
        log.info("Change ledger restored with {} entries", persisted.size());
    }

    public static String newChangeId() {
        return "change-" + System.currentTimeMillis() + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Append a change, evicting the oldest entries beyond capacity.
     */
    public void append(ChangeRecord change) {
        List<String> evicted = new ArrayList<>();
        synchronized (changes) {
            changes.addLast(change);
            while (changes.size() > config.getMaxChanges()) {
                evicted.add(changes.removeFirst().getId());
            }
        }

        try {
            persistence.saveChange(change);
            persistence.deleteChanges(evicted);
        } catch (RuntimeException e) {
            log.error("Failed to persist change {}: {}", change.getId(), e.getMessage(), e);
        }
        if (!evicted.isEmpty()) {
            log.debug("Evicted {} changes from the ledger", evicted.size());
        }
    }

    public Optional<ChangeRecord> find(String changeId) {
        synchronized (changes) {
            for (ChangeRecord change : changes) {
                if (change.getId().equals(changeId)) {
                    return Optional.of(change);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * All entries, newest first.
     */
    public List<ChangeRecord> all() {
        List<ChangeRecord> snapshot;
        synchronized (changes) {
            snapshot = new ArrayList<>(changes);
        }
        Collections.reverse(snapshot);
        snapshot.sort(Comparator.comparing(ChangeRecord::getTimestamp).reversed());
        return snapshot;
    }

    public List<ChangeRecord> recent(int limit) {
        List<ChangeRecord> all = all();
        return new ArrayList<>(all.subList(0, Math.min(limit, all.size())));
    }

    public List<ChangeRecord> revertable() {
        List<ChangeRecord> result = new ArrayList<>();
        for (ChangeRecord change : all()) {
            if (change.isCanRevert()) {
                result.add(change);
            }
        }
        return result;
    }

    /**
     * Bulk deletes and updates, erase-all, restores and anything touching many records.
     */
    public List<ChangeRecord> critical() {
        List<ChangeRecord> result = new ArrayList<>();
        for (ChangeRecord change : all()) {
            if (CRITICAL_KINDS.contains(change.getOperationKind())
                || change.getAffectedRecords() > config.getCriticalRecordThreshold()) {
                result.add(change);
            }
        }
        return result;
    }

    public int size() {
        synchronized (changes) {
            return changes.size();
        }
    }

    // ==================== Revert Bookkeeping ====================

    /**
     * Claim a change for reverting. Only one revert of a change can be in flight.
     *
     * @throws RevertIneligibleException if the change is unknown, not revertable or already being reverted
     */
    public ChangeRecord beginRevert(String changeId) {
        synchronized (changes) {
            ChangeRecord change = find(changeId)
                .orElseThrow(() -> new RevertIneligibleException("Change " + changeId + " not found"));
            if (!change.isCanRevert()) {
                throw new RevertIneligibleException("Change " + changeId + " cannot be reverted");
            }
            if (!revertsInFlight.add(changeId)) {
                throw new RevertIneligibleException("Change " + changeId + " is already being reverted");
            }
            return change;
        }
    }

    public void completeRevert(String changeId) {
        synchronized (changes) {
            revertsInFlight.remove(changeId);
            find(changeId).ifPresent(ChangeRecord::markReverted);
        }
        try {
            persistence.markReverted(changeId);
        } catch (RuntimeException e) {
            log.error("Failed to persist revert flag of {}: {}", changeId, e.getMessage(), e);
        }
    }

    /**
     * Release a claim after a failed revert so it can be retried.
     */
    public void abortRevert(String changeId) {
        synchronized (changes) {
            revertsInFlight.remove(changeId);
        }
    }
}
