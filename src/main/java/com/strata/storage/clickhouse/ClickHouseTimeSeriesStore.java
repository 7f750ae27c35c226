package com.strata.storage.clickhouse;

import com.strata.domain.DataPoint;
import com.strata.domain.DatasetSelector;
import com.strata.domain.StorageTier;
import com.strata.domain.TimeRange;
import com.strata.error.TransientStoreException;
import com.strata.storage.TimeSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link TimeSeriesStore} backed by one ClickHouse table per store-resident tier.
 *
 * Timestamps travel as epoch milliseconds to stay independent of the server
 * time zone. Deletes are lightweight {@code DELETE FROM} range predicates.
 */
@Repository
public class ClickHouseTimeSeriesStore implements TimeSeriesStore {
    private static final Logger logger = LoggerFactory.getLogger(ClickHouseTimeSeriesStore.class);

    private static final String RANGE_PREDICATE = """
        ts >= fromUnixTimestamp64Milli(?) AND ts < fromUnixTimestamp64Milli(?)""";

    private final JdbcTemplate jdbcTemplate;

    public ClickHouseTimeSeriesStore(@Qualifier("clickHouseJdbcTemplate") JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    static String tableFor(StorageTier tier) {
        switch (tier) {
            case HOT:
                return "lifecycle_hot";
            case WARM:
                return "lifecycle_warm";
            default:
                throw new IllegalArgumentException("Tier " + tier + " is not stored in ClickHouse");
        }
    }

    @Override
    public List<DataPoint> query(StorageTier tier, TimeRange range, DatasetSelector selector) {
        String sql = """
            SELECT dataset, entity_id, toUnixTimestamp64Milli(ts) AS ts_ms,
                   value, sample_count, min, max
            FROM %s
            WHERE %s AND %s
            ORDER BY ts
            """.formatted(tableFor(tier), RANGE_PREDICATE, selectorPredicate(selector));
        try {
            return jdbcTemplate.query(sql, rowMapper(tier),
                range.getStart().toEpochMilli(), range.getEnd().toEpochMilli(), selectorArgument(selector));
        } catch (DataAccessException e) {
            throw storeFailure("query", tier, e);
        }
    }

    @Override
    public void write(List<DataPoint> rows) {
        if (rows.isEmpty()) {
            return;
        }
        Map<StorageTier, List<Object[]>> batches = new EnumMap<>(StorageTier.class);
        for (DataPoint row : rows) {
            batches.computeIfAbsent(row.getTier(), t -> new ArrayList<>()).add(new Object[] {
                row.getDataset(),
                row.getEntityId(),
                row.getTimestamp().toEpochMilli(),
                row.getValue(),
                row.getSampleCount(),
                row.getMin(),
                row.getMax()
            });
        }
        for (Map.Entry<StorageTier, List<Object[]>> batch : batches.entrySet()) {
            String sql = """
                INSERT INTO %s (dataset, entity_id, ts, value, sample_count, min, max)
                VALUES (?, ?, fromUnixTimestamp64Milli(?), ?, ?, ?, ?)
                """.formatted(tableFor(batch.getKey()));
            try {
                jdbcTemplate.batchUpdate(sql, batch.getValue());
                logger.debug("Wrote {} rows to {}", batch.getValue().size(), batch.getKey().getValue());
            } catch (DataAccessException e) {
                throw storeFailure("write", batch.getKey(), e);
            }
        }
    }

    @Override
    public long delete(StorageTier tier, TimeRange range, DatasetSelector selector) {
        long matching = count(tier, range, selector);
        if (matching == 0) {
            return 0;
        }
        String sql = """
            DELETE FROM %s WHERE %s AND %s
            """.formatted(tableFor(tier), RANGE_PREDICATE, selectorPredicate(selector));
        try {
            jdbcTemplate.update(sql,
                range.getStart().toEpochMilli(), range.getEnd().toEpochMilli(), selectorArgument(selector));
            logger.debug("Deleted {} rows from {} in {}", matching, tier.getValue(), range);
            return matching;
        } catch (DataAccessException e) {
            throw storeFailure("delete", tier, e);
        }
    }

    @Override
    public long deleteSeries(StorageTier tier, TimeRange range, String dataset, String entityId) {
        String sql = """
            DELETE FROM %s WHERE %s AND dataset = ? AND entity_id = ?
            """.formatted(tableFor(tier), RANGE_PREDICATE);
        try {
            jdbcTemplate.update(sql,
                range.getStart().toEpochMilli(), range.getEnd().toEpochMilli(), dataset, entityId);
            logger.debug("Deleted series {}/{} from {} in {}", dataset, entityId, tier.getValue(), range);
            return -1;
        } catch (DataAccessException e) {
            throw storeFailure("delete", tier, e);
        }
    }

    @Override
    public Optional<Instant> oldestTimestamp(StorageTier tier, DatasetSelector selector) {
        String sql = """
            SELECT count() AS n, min(toUnixTimestamp64Milli(ts)) AS oldest
            FROM %s
            WHERE %s
            """.formatted(tableFor(tier), selectorPredicate(selector));
        try {
            return jdbcTemplate.queryForObject(sql, (rs, rowNum) -> rs.getLong("n") == 0
                ? Optional.<Instant>empty()
                : Optional.of(Instant.ofEpochMilli(rs.getLong("oldest"))), selectorArgument(selector));
        } catch (DataAccessException e) {
            throw storeFailure("oldest timestamp", tier, e);
        }
    }

    @Override
    public long count(StorageTier tier, TimeRange range, DatasetSelector selector) {
        String sql = """
            SELECT count() FROM %s WHERE %s AND %s
            """.formatted(tableFor(tier), RANGE_PREDICATE, selectorPredicate(selector));
        try {
            Long count = jdbcTemplate.queryForObject(sql, Long.class,
                range.getStart().toEpochMilli(), range.getEnd().toEpochMilli(), selectorArgument(selector));
            return count != null ? count : 0;
        } catch (DataAccessException e) {
            throw storeFailure("count", tier, e);
        }
    }

    @Override
    public long sizeInBytes(StorageTier tier) {
        String sql = """
            SELECT sum(bytes_on_disk)
            FROM system.parts
            WHERE active AND database = currentDatabase() AND table = ?
            """;
        try {
            Long bytes = jdbcTemplate.queryForObject(sql, Long.class, tableFor(tier));
            return bytes != null ? bytes : 0;
        } catch (DataAccessException e) {
            throw storeFailure("size", tier, e);
        }
    }

    private static String selectorPredicate(DatasetSelector selector) {
        return selector.isWildcard() ? "startsWith(dataset, ?)" : "dataset = ?";
    }

    private static String selectorArgument(DatasetSelector selector) {
        return selector.getPrefix();
    }

    private static RowMapper<DataPoint> rowMapper(StorageTier tier) {
        return (rs, rowNum) -> new DataPoint(
            tier,
            rs.getString("dataset"),
            rs.getString("entity_id"),
            Instant.ofEpochMilli(rs.getLong("ts_ms")),
            rs.getDouble("value"),
            rs.getLong("sample_count"),
            rs.getDouble("min"),
            rs.getDouble("max"));
    }

    private static TransientStoreException storeFailure(String operation, StorageTier tier, DataAccessException e) {
        logger.error("ClickHouse {} on {} tier failed", operation, tier.getValue(), e);
        return new TransientStoreException("time-series store " + operation + " failed on " + tier.getValue()
            + " tier", e);
    }
}
