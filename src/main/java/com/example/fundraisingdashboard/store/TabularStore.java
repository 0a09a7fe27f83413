package com.example.fundraisingdashboard.store;

import com.example.fundraisingdashboard.model.TableName;

import java.util.List;

/**
 * Row-oriented access to the spreadsheet that backs the dashboard.
 * None of these calls is transactional and the store keeps no history; there is no delete
 * primitive either, a row is deleted by overwriting it with empty cells.
 *
 * Row indexes are 0-based over data rows (the header row is not addressable).
 * Implementations report failures as {@link com.example.fundraisingdashboard.exception.StoreAccessException}.
 */
public interface TabularStore {

    /**
     * All data rows of a table in sheet order, blank rows included.
     */
    List<List<String>> getRows(TableName table);

    /**
     * Append rows after the last data row.
     */
    void appendRows(TableName table, List<List<String>> rows);

    /**
     * Overwrite a single data row in place.
     */
    void updateRow(TableName table, int rowIndex, List<String> row);
}
