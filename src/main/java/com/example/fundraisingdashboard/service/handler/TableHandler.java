package com.example.fundraisingdashboard.service.handler;

import com.example.fundraisingdashboard.exception.StoreAccessException;
import com.example.fundraisingdashboard.model.TableName;
import com.example.fundraisingdashboard.model.WriteOutcome;
import com.example.fundraisingdashboard.store.TableRows;
import com.example.fundraisingdashboard.store.TabularStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Translates record-level create/update/delete requests for one table into the store's
 * get/append/update primitives.
 *
 * Every method reads the table once before writing, so the prior state of each touched row
 * is known before the write is issued. Records are applied one by one: for a single-record
 * request a store failure propagates, for several records it is recorded against that record
 * and the rest carry on. Callers serialize invocations (row indexes are positional).
 */
@Slf4j
public abstract class TableHandler {

    protected final TabularStore store;
    protected final Clock clock;

    protected TableHandler(TabularStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public abstract TableName table();

    /**
     * Prefix of generated ids, or null when callers must supply the key.
     */
    protected String idPrefix() {
        return null;
    }

    /**
     * Fill in defaults on a record about to be created.
     */
    protected void applyDefaults(Map<String, String> record) {
    }

    /**
     * Reject invalid field values with an {@link IllegalArgumentException}.
     */
    protected void validate(Map<String, String> record) {
    }

    // ==================== Operations ====================

    public WriteOutcome create(List<Map<String, Object>> records) {
        TableName table = table();
        Set<String> existingKeys = new HashSet<>();
        for (Map<String, String> live : TableRows.liveRecords(table, store.getRows(table))) {
            existingKeys.add(TableRows.keyOf(table, live));
        }

        WriteOutcome outcome = new WriteOutcome();
        for (Map<String, Object> fields : records) {
            Map<String, String> record = TableRows.toCells(table, fields);
            if (idPrefix() != null && isBlank(record.get("id"))) {
                record.put("id", idPrefix() + "-" + UUID.randomUUID().toString().substring(0, 8));
            }
            applyDefaults(record);

            String key = TableRows.keyOf(table, record);
            if (key == null) {
                outcome.failed("Missing key " + table.getKeyColumns() + " for new " + table.getValue() + " record");
                continue;
            }
            if (existingKeys.contains(key)) {
                outcome.failed(table.getValue() + " record " + key + " already exists");
                continue;
            }
            try {
                validate(record);
            } catch (IllegalArgumentException e) {
                outcome.failed(table.getValue() + " record " + key + ": " + e.getMessage());
                continue;
            }

            Map<String, String> written = TableRows.toRecord(table, TableRows.toRow(table, record));
            try {
                store.appendRows(table, List.of(TableRows.toRow(table, written)));
            } catch (StoreAccessException e) {
                if (records.size() == 1) {
                    throw e;
                }
                log.warn("Create of {} {} failed: {}", table.getValue(), key, e.getMessage());
                outcome.failed(table.getValue() + " record " + key + ": " + e.getMessage());
                continue;
            }
            existingKeys.add(key);
            outcome.applied(null, written, TableRows.keyFields(table, written));
        }
        return outcome;
    }

    public WriteOutcome update(List<Map<String, Object>> records) {
        TableName table = table();
        List<List<String>> rows = store.getRows(table);
        Map<String, Integer> index = indexByKey(rows);

        WriteOutcome outcome = new WriteOutcome();
        for (Map<String, Object> fields : records) {
            Map<String, String> changes = TableRows.toCells(table, fields);
            String key = TableRows.keyOf(table, changes);
            Integer rowIndex = key != null ? index.get(key) : null;
            if (rowIndex == null) {
                outcome.failed("No " + table.getValue() + " record found for " + describeKey(changes));
                continue;
            }

            Map<String, String> before = TableRows.toRecord(table, rows.get(rowIndex));
            Map<String, String> after = new LinkedHashMap<>(before);
            after.putAll(changes);
            try {
                validate(after);
            } catch (IllegalArgumentException e) {
                outcome.failed(table.getValue() + " record " + key + ": " + e.getMessage());
                continue;
            }

            List<String> newRow = TableRows.toRow(table, after);
            try {
                store.updateRow(table, rowIndex, newRow);
            } catch (StoreAccessException e) {
                if (records.size() == 1) {
                    throw e;
                }
                log.warn("Update of {} {} failed: {}", table.getValue(), key, e.getMessage());
                outcome.failed(table.getValue() + " record " + key + ": " + e.getMessage());
                continue;
            }
            rows.set(rowIndex, newRow);
            outcome.applied(before, after, before);
        }
        return outcome;
    }

    public WriteOutcome delete(List<Map<String, Object>> selectors) {
        TableName table = table();
        List<List<String>> rows = store.getRows(table);
        Map<String, Integer> index = indexByKey(rows);

        WriteOutcome outcome = new WriteOutcome();
        for (Map<String, Object> fields : selectors) {
            Map<String, String> selector = TableRows.toCells(table, fields);
            String key = TableRows.keyOf(table, selector);
            Integer rowIndex = key != null ? index.get(key) : null;
            if (rowIndex == null) {
                outcome.failed("No " + table.getValue() + " record found for " + describeKey(selector));
                continue;
            }
            deleteRow(table, rows, rowIndex, key, selectors.size() == 1, outcome);
            index.remove(key);
        }
        return outcome;
    }

    /**
     * Blank every live row of the table.
     */
    public WriteOutcome deleteAll() {
        TableName table = table();
        List<List<String>> rows = store.getRows(table);

        WriteOutcome outcome = new WriteOutcome();
        for (int i = 0; i < rows.size(); i++) {
            if (TableRows.isBlank(rows.get(i))) {
                continue;
            }
            String key = TableRows.keyOf(table, TableRows.toRecord(table, rows.get(i)));
            deleteRow(table, rows, i, key, false, outcome);
        }
        log.info("Cleared {} rows of {} ({} failures)", outcome.getAffectedRecords(), table.getValue(),
            outcome.getFailures().size());
        return outcome;
    }

    /**
     * Live records of the table.
     */
    public List<Map<String, String>> readRecords() {
        return TableRows.liveRecords(table(), store.getRows(table()));
    }

    // ==================== Helpers ====================

    private void deleteRow(TableName table, List<List<String>> rows, int rowIndex, String key,
                           boolean propagate, WriteOutcome outcome) {
        Map<String, String> before = TableRows.toRecord(table, rows.get(rowIndex));
        List<String> blank = TableRows.blankRow(table.getColumns().size());
        try {
            store.updateRow(table, rowIndex, blank);
        } catch (StoreAccessException e) {
            if (propagate) {
                throw e;
            }
            log.warn("Delete of {} {} failed: {}", table.getValue(), key, e.getMessage());
            outcome.failed(table.getValue() + " record " + key + ": " + e.getMessage());
            return;
        }
        rows.set(rowIndex, blank);
        outcome.applied(before, null, before);
    }

    private Map<String, Integer> indexByKey(List<List<String>> rows) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            if (TableRows.isBlank(row)) {
                continue;
            }
            String key = TableRows.keyOf(table(), TableRows.toRecord(table(), row));
            if (key != null) {
                index.putIfAbsent(key, i);
            }
        }
        return index;
    }

    private String describeKey(Map<String, String> fields) {
        StringBuilder sb = new StringBuilder();
        for (String column : table().getKeyColumns()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(column).append('=').append(fields.getOrDefault(column, ""));
        }
        return sb.toString();
    }

    protected static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    protected static void requireNumber(Map<String, String> record, String field) {
        String value = record.get(field);
        if (isBlank(value)) {
            return;
        }
        try {
            Double.parseDouble(value.replace(",", ""));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(field + " must be numeric, got '" + value + "'");
        }
    }

    protected static void requirePresent(Map<String, String> record, String field) {
        if (isBlank(record.get(field))) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}
