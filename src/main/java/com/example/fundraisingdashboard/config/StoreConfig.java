package com.example.fundraisingdashboard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Selects and configures the tabular store adapter.
 */
@Configuration
@ConfigurationProperties(prefix = "store")
@Data
public class StoreConfig {

    /**
     * "memory" or "sheets".
     */
    private String type = "memory";

    private Sheets sheets = new Sheets();

    @Data
    public static class Sheets {
        private String baseUrl = "https://sheets.googleapis.com/v4/spreadsheets";
        private String spreadsheetId;
        private String accessToken;
    }
}
