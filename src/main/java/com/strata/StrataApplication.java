package com.strata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Strata data lifecycle engine.
 *
 * Strata manages time-series data across storage tiers:
 * - Raw data in the hot tier, downsampled aggregates in the warm tier
 * - Archival of old data to object storage as compressed Parquet batches
 * - Full backups of policies, thresholds and store data, with verified restore
 * - Storage usage monitoring with alerting
 *
 * All periodic work is coordinated by the lifecycle scheduler.
 */
@SpringBootApplication
public class StrataApplication {

    public static void main(String[] args) {
        SpringApplication.run(StrataApplication.class, args);
    }
}
