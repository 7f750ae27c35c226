package com.strata.view;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.strata.config.LifecycleProperties;
import com.strata.error.InvalidQueryException;
import com.strata.error.LifecycleException;
import com.strata.error.TransientStoreException;
import com.strata.history.OperationResult;
import com.strata.metrics.LifecycleMetrics;
import com.strata.scheduler.JobContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Refreshes and queries the materialized aggregate views.
 *
 * View names and filter keys are checked against {@link ViewDefinition} before
 * any SQL is built. Query results are cached until the view is refreshed or
 * the entry expires.
 */
@Service
public class MaterializedViewManager {
    private static final Logger logger = LoggerFactory.getLogger(MaterializedViewManager.class);

    private static final int MAX_ROWS = 10000;

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;
    private final LifecycleMetrics metrics;

    /**
     * Caffeine cache for view query results, keyed by view name and sorted filters
     */
    private final Cache<String, List<Map<String, Object>>> queryCache;

    public MaterializedViewManager(@Qualifier("clickHouseJdbcTemplate") JdbcTemplate jdbcTemplate,
                                   LifecycleProperties properties, Clock clock, LifecycleMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
        this.metrics = metrics;
        this.queryCache = Caffeine.newBuilder()
            .maximumSize(properties.getView().getCacheMaxSize())
            .expireAfterWrite(properties.getView().getCacheTtl())
            .recordStats()
            .build();

        logger.info("MaterializedViewManager initialized with cache (TTL={}, maxSize={})",
            properties.getView().getCacheTtl(), properties.getView().getCacheMaxSize());
    }

    /**
     * Rebuild a view from the tier tables.
     */
    public OperationResult refresh(String viewName) {
        ViewDefinition view = resolve(viewName);
        OperationResult result = new OperationResult("refresh_view:" + view.getViewName(), clock.instant());
        try {
            jdbcTemplate.execute("TRUNCATE TABLE IF EXISTS " + view.getTable());
            jdbcTemplate.execute(view.getPopulateSql());
            Long rows = jdbcTemplate.queryForObject("SELECT count() FROM " + view.getTable(), Long.class);
            result.setItemsProcessed(rows != null ? rows : 0);
        } catch (DataAccessException e) {
            logger.error("Failed to refresh view {}", view.getViewName(), e);
            TransientStoreException failure = new TransientStoreException("view refresh failed", e);
            result.fail(clock.instant(), failure);
            throw failure;
        } finally {
            invalidate(view);
        }
        result.succeed(clock.instant());
        logger.info("Refreshed view {} ({} rows)", view.getViewName(), result.getItemsProcessed());
        return result;
    }

    /**
     * Refresh every view; a failing view does not stop the others but fails the run.
     */
    public OperationResult refreshAll(JobContext context) {
        OperationResult result = new OperationResult("refresh_views", clock.instant());
        LifecycleException firstFailure = null;
        for (ViewDefinition view : ViewDefinition.values()) {
            context.throwIfCancelled();
            try {
                result.addItemsProcessed(refresh(view.getViewName()).getItemsProcessed());
            } catch (LifecycleException e) {
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }
        if (firstFailure != null) {
            result.fail(clock.instant(), firstFailure);
            throw firstFailure;
        }
        result.succeed(clock.instant());
        return result;
    }

    /**
     * Query a view with equality filters on its allow-listed columns and an
     * optional {@code from}/{@code to} time bound (ISO-8601 instants).
     */
    public List<Map<String, Object>> query(String viewName, Map<String, String> filters) {
        ViewDefinition view = resolve(viewName);
        Map<String, String> sorted = new TreeMap<>(filters != null ? filters : Map.of());
        for (String key : sorted.keySet()) {
            if (!view.acceptsFilter(key)) {
                throw new InvalidQueryException("view '" + view.getViewName() + "' cannot be filtered by '" + key + "'");
            }
        }

        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(view.getTable()).append(" WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        for (Map.Entry<String, String> filter : sorted.entrySet()) {
            if (ViewDefinition.FROM.equals(filter.getKey())) {
                sql.append(" AND ").append(view.getTimeColumn()).append(" >= fromUnixTimestamp64Milli(?)");
                args.add(parseInstant(filter).toEpochMilli());
            } else if (ViewDefinition.TO.equals(filter.getKey())) {
                sql.append(" AND ").append(view.getTimeColumn()).append(" < fromUnixTimestamp64Milli(?)");
                args.add(parseInstant(filter).toEpochMilli());
            } else {
                sql.append(" AND ").append(filter.getKey()).append(" = ?");
                args.add(filter.getValue());
            }
        }
        sql.append(" ORDER BY ").append(view.getTimeColumn()).append(" LIMIT ").append(MAX_ROWS);

        String cacheKey = view.getViewName() + "|" + sorted;
        List<Map<String, Object>> cached = queryCache.getIfPresent(cacheKey);
        if (cached != null) {
            metrics.recordViewCacheHit();
            return cached;
        }
        metrics.recordViewCacheMiss();

        try {
            List<Map<String, Object>> rows = List.copyOf(jdbcTemplate.queryForList(sql.toString(), args.toArray()));
            queryCache.put(cacheKey, rows);
            return rows;
        } catch (DataAccessException e) {
            logger.error("Failed to query view {}", view.getViewName(), e);
            throw new TransientStoreException("view query failed", e);
        }
    }

    private static ViewDefinition resolve(String viewName) {
        return ViewDefinition.byName(viewName)
            .orElseThrow(() -> new InvalidQueryException("unknown view '" + viewName + "'"));
    }

    private static Instant parseInstant(Map.Entry<String, String> filter) {
        try {
            return Instant.parse(filter.getValue());
        } catch (DateTimeParseException | NullPointerException e) {
            throw new InvalidQueryException("filter '" + filter.getKey() + "' must be an ISO-8601 instant");
        }
    }

    private void invalidate(ViewDefinition view) {
        queryCache.asMap().keySet().removeIf(key -> key.startsWith(view.getViewName() + "|"));
    }

    public List<String> viewNames() {
        List<String> names = new ArrayList<>();
        for (ViewDefinition view : ViewDefinition.values()) {
            names.add(view.getViewName());
        }
        return names;
    }
}
