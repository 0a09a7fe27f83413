package com.example.fundraisingdashboard.service;

import com.example.fundraisingdashboard.config.PipelineConfig;
import com.example.fundraisingdashboard.exception.SnapshotNotFoundException;
import com.example.fundraisingdashboard.model.BackupSnapshot;
import com.example.fundraisingdashboard.model.PipelineEvent;
import com.example.fundraisingdashboard.model.TableName;
import com.example.fundraisingdashboard.persistence.ChangeHistoryPersistenceService;
import com.example.fundraisingdashboard.store.TabularStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Takes and keeps full backups of every data table, up to a fixed number.
 */
@Slf4j
@Service
public class SnapshotManager {

    private final Deque<BackupSnapshot> snapshots = new ArrayDeque<>();
    private final TabularStore store;
    private final PipelineConfig config;
    private final ChangeHistoryPersistenceService persistence;
    private final PipelineEventLog eventLog;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SnapshotManager(TabularStore store, PipelineConfig config, ChangeHistoryPersistenceService persistence,
                           PipelineEventLog eventLog, ObjectMapper objectMapper, Clock clock) {
        this.store = store;
        this.config = config;
        this.persistence = persistence;
        this.eventLog = eventLog;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @PostConstruct
    public void loadPersisted() {
        List<BackupSnapshot> persisted;
        try {
            persisted = persistence.loadSnapshots(config.getMaxSnapshots());
        } catch (RuntimeException e) {
            log.error("Could not load snapshots, starting empty: {}", e.getMessage(), e);
            return;
        }
        synchronized (snapshots) {
            for (BackupSnapshot snapshot : persisted) {
                snapshots.addFirst(snapshot);
            }
        }
    }

    /**
     * Read every data table and keep the result as a new snapshot.
     * A store failure propagates and no snapshot is kept.
     */
    public BackupSnapshot createSnapshot(String description) {
        Map<TableName, List<List<String>>> tables = new EnumMap<>(TableName.class);
        for (TableName table : TableName.dataTables()) {
            tables.put(table, store.getRows(table));
        }

        long sizeBytes = estimateSize(tables);
        String id = "snapshot-" + clock.millis() + "-" + UUID.randomUUID().toString().substring(0, 6);
        BackupSnapshot snapshot = new BackupSnapshot(id, clock.instant(), description, sizeBytes, tables);

        List<String> evicted = new ArrayList<>();
        synchronized (snapshots) {
            snapshots.addLast(snapshot);
            while (snapshots.size() > config.getMaxSnapshots()) {
                evicted.add(snapshots.removeFirst().getId());
            }
        }

        try {
            persistence.saveSnapshot(snapshot);
            persistence.deleteSnapshots(evicted);
        } catch (RuntimeException e) {
            log.error("Failed to persist snapshot {}: {}", id, e.getMessage(), e);
        }

        log.info("Snapshot {} created: {} (rows={}, size={} bytes)",
            id, description, snapshot.getRowCounts(), sizeBytes);
        eventLog.record(PipelineEvent.EventType.SNAPSHOT_CREATED, description, id, null);
        return snapshot;
    }

    public Optional<BackupSnapshot> get(String snapshotId) {
        synchronized (snapshots) {
            for (BackupSnapshot snapshot : snapshots) {
                if (snapshot.getId().equals(snapshotId)) {
                    return Optional.of(snapshot);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * @throws SnapshotNotFoundException if no retained snapshot has this id
     */
    public BackupSnapshot require(String snapshotId) {
        return get(snapshotId)
            .orElseThrow(() -> new SnapshotNotFoundException("Snapshot " + snapshotId + " not found"));
    }

    /**
     * Retained snapshots, newest first.
     */
    public List<BackupSnapshot> list() {
        List<BackupSnapshot> result;
        synchronized (snapshots) {
            result = new ArrayList<>(snapshots);
        }
        Collections.reverse(result);
        result.sort(Comparator.comparing(BackupSnapshot::getTimestamp).reversed());
        return result;
    }

    private long estimateSize(Map<TableName, List<List<String>>> tables) {
        try {
            return objectMapper.writeValueAsBytes(tables).length;
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize snapshot for sizing, estimating: {}", e.getMessage());
            long size = 0;
            for (List<List<String>> rows : tables.values()) {
                for (List<String> row : rows) {
                    for (String cell : row) {
                        size += cell != null ? cell.length() + 3 : 3;
                    }
                }
            }
            return size;
        }
    }
}
