package com.strata.view;

import java.util.Optional;
import java.util.Set;

/**
 * Allow-list of materialized views. Only names and columns declared here ever
 * reach SQL text; filter values are always bound parameters.
 */
public enum ViewDefinition {

    /**
     * Per-dataset hourly point counts and value statistics across hot and warm rows
     */
    HOURLY_DATASET_STATS("hourly_dataset_stats", "mv_hourly_dataset_stats", "bucket", Set.of("dataset"), """
        INSERT INTO mv_hourly_dataset_stats
        SELECT
            toStartOfHour(ts) AS bucket,
            dataset,
            count() AS points,
            sum(sample_count) AS samples,
            avg(value) AS avg_value,
            min(min) AS min_value,
            max(max) AS max_value
        FROM (
            SELECT dataset, ts, value, sample_count, min, max FROM lifecycle_hot
            UNION ALL
            SELECT dataset, ts, value, sample_count, min, max FROM lifecycle_warm
        )
        GROUP BY bucket, dataset
        """),

    /**
     * Per-entity daily statistics
     */
    DAILY_ENTITY_STATS("daily_entity_stats", "mv_daily_entity_stats", "day", Set.of("dataset", "entity_id"), """
        INSERT INTO mv_daily_entity_stats
        SELECT
            toDate(ts) AS day,
            dataset,
            entity_id,
            count() AS points,
            sum(sample_count) AS samples,
            avg(value) AS avg_value,
            min(min) AS min_value,
            max(max) AS max_value
        FROM (
            SELECT dataset, entity_id, ts, value, sample_count, min, max FROM lifecycle_hot
            UNION ALL
            SELECT dataset, entity_id, ts, value, sample_count, min, max FROM lifecycle_warm
        )
        GROUP BY day, dataset, entity_id
        """);

    /**
     * Filter keys bounding the time column: {@code from} inclusive, {@code to} exclusive
     */
    public static final String FROM = "from";
    public static final String TO = "to";

    private final String viewName;
    private final String table;
    private final String timeColumn;
    private final Set<String> filterColumns;
    private final String populateSql;

    ViewDefinition(String viewName, String table, String timeColumn, Set<String> filterColumns, String populateSql) {
        this.viewName = viewName;
        this.table = table;
        this.timeColumn = timeColumn;
        this.filterColumns = filterColumns;
        this.populateSql = populateSql;
    }

    public String getViewName() {
        return viewName;
    }

    public String getTable() {
        return table;
    }

    public String getTimeColumn() {
        return timeColumn;
    }

    public Set<String> getFilterColumns() {
        return filterColumns;
    }

    public String getPopulateSql() {
        return populateSql;
    }

    public boolean acceptsFilter(String key) {
        return filterColumns.contains(key) || FROM.equals(key) || TO.equals(key);
    }

    public static Optional<ViewDefinition> byName(String viewName) {
        for (ViewDefinition view : values()) {
            if (view.viewName.equals(viewName)) {
                return Optional.of(view);
            }
        }
        return Optional.empty();
    }
}
