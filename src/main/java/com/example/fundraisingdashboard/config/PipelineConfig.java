package com.example.fundraisingdashboard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Capacities and timeouts of the change pipeline.
 */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Data
public class PipelineConfig {

    /**
     * Change ledger capacity; the oldest entry is evicted beyond it.
     */
    private int maxChanges = 100;

    /**
     * Backup snapshot capacity; the oldest snapshot is evicted beyond it.
     */
    private int maxSnapshots = 10;

    /**
     * Changes touching more records than this are listed as critical.
     */
    private int criticalRecordThreshold = 10;

    /**
     * How long a gated operation stays confirmable.
     */
    private Duration confirmationTtl = Duration.ofMinutes(5);

    private long confirmationSweepIntervalMs = 60_000;

    private int maxEvents = 200;
}
