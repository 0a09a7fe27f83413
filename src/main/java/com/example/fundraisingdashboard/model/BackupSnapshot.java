package com.example.fundraisingdashboard.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Full point-in-time copy of every table.
 * Rows are kept positionally, blank rows included, so a restore can put each row back where it was.
 */
@Getter
@ToString(exclude = "tables")
public class BackupSnapshot {

    private final String id;
    private final Instant timestamp;
    private final String description;

    /**
     * Serialized size in bytes, for monitoring.
     */
    private final long sizeBytes;

    @JsonIgnore
    private final Map<TableName, List<List<String>>> tables;

    public BackupSnapshot(String id, Instant timestamp, String description, long sizeBytes,
                          Map<TableName, List<List<String>>> tables) {
        this.id = id;
        this.timestamp = timestamp;
        this.description = description;
        this.sizeBytes = sizeBytes;

        Map<TableName, List<List<String>>> copy = new EnumMap<>(TableName.class);
        tables.forEach((table, rows) -> {
            List<List<String>> rowsCopy = new ArrayList<>(rows.size());
            for (List<String> row : rows) {
                rowsCopy.add(List.copyOf(row));
            }
            copy.put(table, Collections.unmodifiableList(rowsCopy));
        });
        this.tables = Collections.unmodifiableMap(copy);
    }

    public List<List<String>> rows(TableName table) {
        return tables.getOrDefault(table, List.of());
    }

    /**
     * Row count per table, blank rows included.
     */
    public Map<String, Integer> getRowCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        tables.forEach((table, rows) -> counts.put(table.getValue(), rows.size()));
        return counts;
    }
}
