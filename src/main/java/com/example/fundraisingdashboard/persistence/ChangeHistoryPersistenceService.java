package com.example.fundraisingdashboard.persistence;

import com.example.fundraisingdashboard.model.BackupSnapshot;
import com.example.fundraisingdashboard.model.ChangeRecord;
import com.example.fundraisingdashboard.model.OperationKind;
import com.example.fundraisingdashboard.model.TableName;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Write-through storage for the change ledger and the backup snapshots, so both survive a restart.
 * The in-memory structures stay authoritative while the process runs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChangeHistoryPersistenceService {

    private static final TypeReference<List<Map<String, String>>> RECORDS_TYPE =
        new TypeReference<List<Map<String, String>>>() { };
    private static final TypeReference<Map<String, List<List<String>>>> TABLES_TYPE =
        new TypeReference<Map<String, List<List<String>>>>() { };

    private final ChangeRecordRepository changeRepository;
    private final BackupSnapshotRepository snapshotRepository;
    private final ObjectMapper objectMapper;

    // ==================== Change Persistence ====================

    @Transactional
    public void saveChange(ChangeRecord change) {
        ChangeRecordEntity entity = new ChangeRecordEntity(
            change.getId(),
            change.getTimestamp().toEpochMilli(),
            change.getOperationKind().name(),
            change.getTable().name(),
            change.getDescription(),
            write(change.getBeforeData()),
            write(change.getAfterData()),
            write(change.getRevertData()),
            change.getAffectedRecords(),
            change.getRequestedBy(),
            change.getRevertOf(),
            change.isCanRevert()
        );
        changeRepository.save(entity);
        log.debug("Persisted change {} ({} on {})", change.getId(),
            change.getOperationKind().getValue(), change.getTable().getValue());
    }

    /**
     * Clear the revert flag of a persisted change.
     */
    @Transactional
    public void markReverted(String changeId) {
        changeRepository.findById(changeId).ifPresent(entity -> {
            entity.setCanRevert(false);
            changeRepository.save(entity);
        });
    }

    @Transactional
    public void deleteChanges(Collection<String> changeIds) {
        if (!changeIds.isEmpty()) {
            changeRepository.deleteAllById(changeIds);
            log.debug("Evicted {} persisted changes", changeIds.size());
        }
    }

    /**
     * Load up to {@code limit} most recent changes, newest first. Unreadable rows are skipped.
     */
    public List<ChangeRecord> loadChanges(int limit) {
        List<ChangeRecord> changes = new ArrayList<>();
        for (ChangeRecordEntity entity : changeRepository.findAllByOrderByTimestampDesc(PageRequest.of(0, limit))) {
            try {
                changes.add(ChangeRecord.builder()
                    .id(entity.getId())
                    .timestamp(Instant.ofEpochMilli(entity.getTimestamp()))
                    .operationKind(OperationKind.valueOf(entity.getOperationKind()))
                    .table(TableName.valueOf(entity.getTableName()))
                    .description(entity.getDescription())
                    .beforeData(objectMapper.readValue(entity.getBeforeData(), RECORDS_TYPE))
                    .afterData(objectMapper.readValue(entity.getAfterData(), RECORDS_TYPE))
                    .revertData(objectMapper.readValue(entity.getRevertData(), RECORDS_TYPE))
                    .affectedRecords(entity.getAffectedRecords())
                    .requestedBy(entity.getRequestedBy())
                    .revertOf(entity.getRevertOf())
                    .canRevert(entity.isCanRevert())
                    .build());
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.error("Skipping unreadable change {}: {}", entity.getId(), e.getMessage());
            }
        }
        log.info("Loaded {} changes from persistent storage", changes.size());
        return changes;
    }

    // ==================== Snapshot Persistence ====================

    @Transactional
    public void saveSnapshot(BackupSnapshot snapshot) {
        Map<String, List<List<String>>> tables = new LinkedHashMap<>();
        snapshot.getTables().forEach((table, rows) -> tables.put(table.name(), rows));

        BackupSnapshotEntity entity = new BackupSnapshotEntity(
            snapshot.getId(),
            snapshot.getTimestamp().toEpochMilli(),
            snapshot.getDescription(),
            write(tables),
            snapshot.getSizeBytes()
        );
        snapshotRepository.save(entity);
        log.info("Saved snapshot {}: size={} bytes", snapshot.getId(), snapshot.getSizeBytes());
    }

    @Transactional
    public void deleteSnapshots(Collection<String> snapshotIds) {
        if (!snapshotIds.isEmpty()) {
            snapshotRepository.deleteAllById(snapshotIds);
            log.debug("Evicted {} persisted snapshots", snapshotIds.size());
        }
    }

    /**
     * Load up to {@code limit} most recent snapshots, newest first.
     */
    public List<BackupSnapshot> loadSnapshots(int limit) {
        List<BackupSnapshot> snapshots = new ArrayList<>();
        for (BackupSnapshotEntity entity : snapshotRepository.findAllByOrderByTimestampDesc(PageRequest.of(0, limit))) {
            try {
                Map<TableName, List<List<String>>> tables = new EnumMap<>(TableName.class);
                objectMapper.readValue(entity.getTablesData(), TABLES_TYPE)
                    .forEach((name, rows) -> tables.put(TableName.valueOf(name), rows));
                snapshots.add(new BackupSnapshot(
                    entity.getId(),
                    Instant.ofEpochMilli(entity.getTimestamp()),
                    entity.getDescription(),
                    entity.getSizeBytes(),
                    tables
                ));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.error("Failed to load snapshot {}: {}", entity.getId(), e.getMessage(), e);
            }
        }
        log.info("Loaded {} snapshots from persistent storage", snapshots.size());
        return snapshots;
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
