package com.example.fundraisingdashboard.store;

import com.example.fundraisingdashboard.model.TableName;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Conversions between positional sheet rows and named records.
 */
public final class TableRows {

    private TableRows() {
    }

    /**
     * Map a row onto the table's columns. Short rows (trailing cells trimmed by the store) are padded.
     */
    public static Map<String, String> toRecord(TableName table, List<String> row) {
        Map<String, String> record = new LinkedHashMap<>();
        List<String> columns = table.getColumns();
        for (int i = 0; i < columns.size(); i++) {
            String value = i < row.size() && row.get(i) != null ? row.get(i) : "";
            record.put(columns.get(i), value);
        }
        return record;
    }

    public static List<String> toRow(TableName table, Map<String, String> record) {
        List<String> row = new ArrayList<>(table.getColumns().size());
        for (String column : table.getColumns()) {
            String value = record.get(column);
            row.add(value != null ? value : "");
        }
        return row;
    }

    public static List<String> blankRow(int width) {
        return new ArrayList<>(Collections.nCopies(width, ""));
    }

    /**
     * A row whose cells are all empty. Deleted rows look like this.
     */
    public static boolean isBlank(List<String> row) {
        if (row == null) {
            return true;
        }
        for (String cell : row) {
            if (cell != null && !cell.isBlank()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Live (non-blank) rows as records.
     */
    public static List<Map<String, String>> liveRecords(TableName table, List<List<String>> rows) {
        List<Map<String, String>> records = new ArrayList<>();
        for (List<String> row : rows) {
            if (!isBlank(row)) {
                records.add(toRecord(table, row));
            }
        }
        return records;
    }

    /**
     * Key of a record, or null when any key column is empty.
     */
    public static String keyOf(TableName table, Map<String, String> record) {
        List<String> parts = new ArrayList<>();
        for (String column : table.getKeyColumns()) {
            String value = record.get(column);
            if (value == null || value.isBlank()) {
                return null;
            }
            parts.add(value.trim());
        }
        return String.join("|", parts);
    }

    public static Map<String, String> keyFields(TableName table, Map<String, String> record) {
        Map<String, String> key = new LinkedHashMap<>();
        for (String column : table.getKeyColumns()) {
            key.put(column, record.get(column));
        }
        return key;
    }

    /**
     * Render a payload value as a sheet cell.
     */
    public static String formatValue(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream()
                .map(TableRows::formatValue)
                .collect(Collectors.joining(", "));
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).stripTrailingZeros().toPlainString();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return value.toString();
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }

    /**
     * Payload fields as cells, restricted to the table's columns.
     */
    public static Map<String, String> toCells(TableName table, Map<String, Object> fields) {
        Map<String, String> cells = new LinkedHashMap<>();
        for (String column : table.getColumns()) {
            if (fields.containsKey(column)) {
                cells.put(column, formatValue(fields.get(column)));
            }
        }
        return cells;
    }
}
