package com.example.fundraisingdashboard.store;

import com.example.fundraisingdashboard.config.StoreConfig;
import com.example.fundraisingdashboard.exception.StoreAccessException;
import com.example.fundraisingdashboard.model.TableName;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Tabular store backed by a spreadsheet values REST API (A1 ranges, RAW value input).
 * Data starts on sheet row 2; row 1 holds the headers.
 */
@Component
@ConditionalOnProperty(name = "store.type", havingValue = "sheets")
@Slf4j
public class SheetsTabularStore implements TabularStore {

    private static final int FIRST_DATA_ROW = 2;

    private final RestTemplate restTemplate;
    private final StoreConfig.Sheets config;

    public SheetsTabularStore(RestTemplate restTemplate, StoreConfig storeConfig) {
        this.restTemplate = restTemplate;
        this.config = storeConfig.getSheets();
        log.info("Sheets store configured for spreadsheet {}", config.getSpreadsheetId());
    }

    @Override
    public List<List<String>> getRows(TableName table) {
        String range = String.format("%s!A%d:%s", table.getSheetName(), FIRST_DATA_ROW, lastColumn(table));
        try {
            ValueRange response = restTemplate.exchange(
                config.getBaseUrl() + "/{spreadsheetId}/values/{range}",
                HttpMethod.GET,
                new HttpEntity<>(headers()),
                ValueRange.class,
                config.getSpreadsheetId(), range).getBody();

            List<List<String>> rows = new ArrayList<>();
            if (response != null && response.getValues() != null) {
                for (List<String> row : response.getValues()) {
                    rows.add(row != null ? new ArrayList<>(row) : new ArrayList<>());
                }
            }
            log.debug("Read {} rows from {}", rows.size(), range);
            return rows;
        } catch (RestClientException e) {
            log.error("Failed to read {}: {}", range, e.getMessage());
            throw new StoreAccessException("Failed to read " + table.getSheetName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void appendRows(TableName table, List<List<String>> rows) {
        String range = String.format("%s!A:%s", table.getSheetName(), lastColumn(table));
        try {
            restTemplate.exchange(
                config.getBaseUrl() + "/{spreadsheetId}/values/{range}:append"
                    + "?valueInputOption=RAW&insertDataOption=INSERT_ROWS",
                HttpMethod.POST,
                new HttpEntity<>(new ValueRange(range, rows), headers()),
                ValueRange.class,
                config.getSpreadsheetId(), range);
            log.debug("Appended {} rows to {}", rows.size(), range);
        } catch (RestClientException e) {
            log.error("Failed to append to {}: {}", range, e.getMessage());
            throw new StoreAccessException("Failed to append to " + table.getSheetName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void updateRow(TableName table, int rowIndex, List<String> row) {
        int sheetRow = rowIndex + FIRST_DATA_ROW;
        String range = String.format("%s!A%d:%s%d", table.getSheetName(), sheetRow, lastColumn(table), sheetRow);
        try {
            restTemplate.exchange(
                config.getBaseUrl() + "/{spreadsheetId}/values/{range}?valueInputOption=RAW",
                HttpMethod.PUT,
                new HttpEntity<>(new ValueRange(range, List.of(row)), headers()),
                ValueRange.class,
                config.getSpreadsheetId(), range);
        } catch (RestClientException e) {
            log.error("Failed to update {}: {}", range, e.getMessage());
            throw new StoreAccessException("Failed to update " + table.getSheetName() + " row " + rowIndex
                + ": " + e.getMessage(), e);
        }
    }

    static String lastColumn(TableName table) {
        int index = Math.max(table.getColumns().size(), 1) - 1;
        StringBuilder letters = new StringBuilder();
        do {
            letters.insert(0, (char) ('A' + index % 26));
            index = index / 26 - 1;
        } while (index >= 0);
        return letters.toString();
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (config.getAccessToken() != null && !config.getAccessToken().isBlank()) {
            headers.setBearerAuth(config.getAccessToken());
        }
        return headers;
    }

    /**
     * Wire shape of the values API.
     */
    @Data
    @NoArgsConstructor
    public static class ValueRange {
        private String range;
        private String majorDimension = "ROWS";
        private List<List<String>> values;

        public ValueRange(String range, List<List<String>> values) {
            this.range = range;
            this.values = values;
        }
    }
}
