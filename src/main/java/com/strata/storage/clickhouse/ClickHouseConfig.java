package com.strata.storage.clickhouse;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Configuration for the ClickHouse JDBC connection pool backing the hot and
 * warm tiers.
 */
@Configuration
public class ClickHouseConfig {
    private static final Logger logger = LoggerFactory.getLogger(ClickHouseConfig.class);

    @Value("${strata.storage.clickhouse.url:jdbc:clickhouse://localhost:8123/strata}")
    private String url;

    @Value("${strata.storage.clickhouse.username:default}")
    private String username;

    @Value("${strata.storage.clickhouse.password:}")
    private String password;

    @Value("${strata.storage.clickhouse.pool.size:10}")
    private int poolSize;

    @Bean(name = "clickHouseDataSource")
    public DataSource clickHouseDataSource() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(username);
        config.setPassword(password);
        config.setDriverClassName("com.clickhouse.jdbc.ClickHouseDriver");
        config.setPoolName("clickhouse-lifecycle");

        // Connection pool settings
        config.setMaximumPoolSize(poolSize);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(30000);
        config.setIdleTimeout(600000);
        config.setMaxLifetime(1800000);
        // start even when the store is down; jobs fail transiently and retry
        config.setInitializationFailTimeout(-1);

        // ClickHouse-specific settings
        config.addDataSourceProperty("socket_timeout", "300000");
        config.addDataSourceProperty("compress", "true");
        config.addDataSourceProperty("max_execution_time", "300");

        HikariDataSource dataSource = new HikariDataSource(config);
        logger.info("ClickHouse DataSource initialized: {}", url);
        return dataSource;
    }

    @Bean(name = "clickHouseJdbcTemplate")
    public JdbcTemplate clickHouseJdbcTemplate(@Qualifier("clickHouseDataSource") DataSource clickHouseDataSource) {
        return new JdbcTemplate(clickHouseDataSource);
    }
}
