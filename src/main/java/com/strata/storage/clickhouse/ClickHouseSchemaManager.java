package com.strata.storage.clickhouse;

import com.strata.domain.StorageTier;
import com.strata.view.ViewDefinition;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the tier tables and the materialized view target tables on startup.
 */
@Component
public class ClickHouseSchemaManager {
    private static final Logger logger = LoggerFactory.getLogger(ClickHouseSchemaManager.class);

    private final JdbcTemplate jdbcTemplate;

    public ClickHouseSchemaManager(@Qualifier("clickHouseJdbcTemplate") JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @PostConstruct
    public void createTables() {
        try {
            createTierTable(StorageTier.HOT);
            createTierTable(StorageTier.WARM);
            createHourlyDatasetStatsTable();
            createDailyEntityStatsTable();
            logger.info("ClickHouse schema initialized successfully");
        } catch (Exception e) {
            logger.error("Failed to initialize ClickHouse schema", e);
            // Don't throw - the scheduler retries once the store is reachable
        }
    }

    /**
     * One table per store-resident tier, partitioned by month so range deletes
     * of old data touch few parts.
     */
    private void createTierTable(StorageTier tier) {
        String table = ClickHouseTimeSeriesStore.tableFor(tier);
        String sql = """
            CREATE TABLE IF NOT EXISTS %s (
                dataset LowCardinality(String),
                entity_id String,
                ts DateTime64(3, 'UTC'),
                value Float64,
                sample_count UInt64,
                min Float64,
                max Float64
            )
            ENGINE = MergeTree()
            PARTITION BY toYYYYMM(ts)
            ORDER BY (dataset, entity_id, ts)
            SETTINGS index_granularity = 8192
            """.formatted(table);

        jdbcTemplate.execute(sql);
        logger.info("Created table: {}", table);
    }

    private void createHourlyDatasetStatsTable() {
        String sql = """
            CREATE TABLE IF NOT EXISTS %s (
                bucket DateTime('UTC'),
                dataset LowCardinality(String),
                points UInt64,
                samples UInt64,
                avg_value Float64,
                min_value Float64,
                max_value Float64
            )
            ENGINE = MergeTree()
            PARTITION BY toYYYYMM(bucket)
            ORDER BY (dataset, bucket)
            """.formatted(ViewDefinition.HOURLY_DATASET_STATS.getTable());

        jdbcTemplate.execute(sql);
        logger.info("Created table: {}", ViewDefinition.HOURLY_DATASET_STATS.getTable());
    }

    private void createDailyEntityStatsTable() {
        String sql = """
            CREATE TABLE IF NOT EXISTS %s (
                day Date,
                dataset LowCardinality(String),
                entity_id String,
                points UInt64,
                samples UInt64,
                avg_value Float64,
                min_value Float64,
                max_value Float64
            )
            ENGINE = MergeTree()
            PARTITION BY toYYYYMM(day)
            ORDER BY (dataset, entity_id, day)
            """.formatted(ViewDefinition.DAILY_ENTITY_STATS.getTable());

        jdbcTemplate.execute(sql);
        logger.info("Created table: {}", ViewDefinition.DAILY_ENTITY_STATS.getTable());
    }
}
