package com.example.fundraisingdashboard.store;

import com.example.fundraisingdashboard.exception.StoreAccessException;
import com.example.fundraisingdashboard.model.TableName;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * In-process tabular store for development and tests.
 * Behaves like the spreadsheet: positional rows, no delete, no history.
 */
@Component
@ConditionalOnProperty(name = "store.type", havingValue = "memory", matchIfMissing = true)
@Slf4j
public class InMemoryTabularStore implements TabularStore {

    private final Map<TableName, List<List<String>>> tables = new EnumMap<>(TableName.class);

    public InMemoryTabularStore() {
        for (TableName table : TableName.dataTables()) {
            tables.put(table, new ArrayList<>());
        }
    }

    @Override
    public synchronized List<List<String>> getRows(TableName table) {
        List<List<String>> rows = table(table);
        List<List<String>> copy = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            copy.add(new ArrayList<>(row));
        }
        return copy;
    }

    @Override
    public synchronized void appendRows(TableName table, List<List<String>> rows) {
        List<List<String>> target = table(table);
        for (List<String> row : rows) {
            target.add(new ArrayList<>(row));
        }
        log.debug("Appended {} rows to {}", rows.size(), table.getSheetName());
    }

    @Override
    public synchronized void updateRow(TableName table, int rowIndex, List<String> row) {
        List<List<String>> target = table(table);
        if (rowIndex < 0 || rowIndex >= target.size()) {
            throw new StoreAccessException(
                "Row " + rowIndex + " is out of range for " + table.getSheetName() + " (" + target.size() + " rows)");
        }
        target.set(rowIndex, new ArrayList<>(row));
    }

    /**
     * Replace a table's contents wholesale. Used to seed development data and test fixtures.
     */
    public synchronized void seed(TableName table, List<List<String>> rows) {
        List<List<String>> target = table(table);
        target.clear();
        for (List<String> row : rows) {
            target.add(new ArrayList<>(row));
        }
    }

    private List<List<String>> table(TableName table) {
        List<List<String>> rows = tables.get(table);
        if (rows == null) {
            throw new StoreAccessException("No such table: " + table.getValue());
        }
        return rows;
    }
}
