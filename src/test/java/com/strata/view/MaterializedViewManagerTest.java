package com.strata.view;

import com.strata.config.LifecycleProperties;
import com.strata.error.InvalidQueryException;
import com.strata.error.TransientStoreException;
import com.strata.history.OperationResult;
import com.strata.metrics.LifecycleMetrics;
import com.strata.scheduler.JobContext;
import com.strata.scheduler.JobType;
import com.strata.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MaterializedViewManager Tests")
class MaterializedViewManagerTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private LifecycleMetrics metrics;
    private MaterializedViewManager manager;

    @BeforeEach
    void setUp() {
        LifecycleProperties properties = TestProperties.under(Path.of("unused"));
        metrics = TestProperties.metrics();
        Clock clock = Clock.fixed(Instant.parse("2024-03-10T12:00:00Z"), ZoneOffset.UTC);
        manager = new MaterializedViewManager(jdbcTemplate, properties, clock, metrics);
    }

    @Test
    @DisplayName("Unknown views are rejected without touching the database")
    void unknownViewShouldBeRejected() {
        assertThatThrownBy(() -> manager.query("users; DROP TABLE lifecycle_hot", Map.of()))
            .isInstanceOf(InvalidQueryException.class)
            .hasMessageContaining("unknown view");

        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    @DisplayName("Filter keys outside the view's columns are rejected")
    void unknownFilterShouldBeRejected() {
        assertThatThrownBy(() -> manager.query("hourly_dataset_stats", Map.of("1=1 OR dataset", "x")))
            .isInstanceOf(InvalidQueryException.class)
            .hasMessageContaining("cannot be filtered");

        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    @DisplayName("Time bounds must be ISO-8601 instants")
    void malformedTimeBoundShouldBeRejected() {
        assertThatThrownBy(() -> manager.query("hourly_dataset_stats", Map.of("from", "yesterday")))
            .isInstanceOf(InvalidQueryException.class)
            .hasMessage("filter 'from' must be an ISO-8601 instant");

        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    @DisplayName("Filters become bound parameters on allow-listed columns")
    void queryShouldBindFilterValues() {
        // Given
        List<Map<String, Object>> rows = List.of(Map.of("dataset", "cpu", "points", 12L));
        when(jdbcTemplate.queryForList(anyString(), any(Object[].class))).thenReturn(rows);

        // When
        List<Map<String, Object>> result = manager.query("hourly_dataset_stats",
            Map.of("from", "2024-03-10T00:00:00Z", "dataset", "cpu"));

        // Then
        assertThat(result).isEqualTo(rows);
        verify(jdbcTemplate).queryForList(
            "SELECT * FROM mv_hourly_dataset_stats WHERE 1 = 1 AND dataset = ?"
                + " AND bucket >= fromUnixTimestamp64Milli(?) ORDER BY bucket LIMIT 10000",
            "cpu", 1710028800000L);
    }

    @Test
    @DisplayName("Repeated queries are served from the cache until the view is refreshed")
    void refreshShouldInvalidateCachedResults() {
        // Given
        when(jdbcTemplate.queryForList(anyString(), any(Object[].class)))
            .thenReturn(List.of(Map.of("points", 1L)), List.of(Map.of("points", 2L)));
        when(jdbcTemplate.queryForObject(anyString(), eq(Long.class))).thenReturn(7L);
        Map<String, String> filters = Map.of("dataset", "cpu");

        // When
        List<Map<String, Object>> first = manager.query("daily_entity_stats", filters);
        List<Map<String, Object>> cached = manager.query("daily_entity_stats", filters);
        OperationResult refresh = manager.refresh("daily_entity_stats");
        List<Map<String, Object>> fresh = manager.query("daily_entity_stats", filters);

        // Then
        assertThat(cached).isEqualTo(first);
        assertThat(fresh).containsExactly(Map.of("points", 2L));
        assertThat(refresh.isSuccess()).isTrue();
        assertThat(refresh.getItemsProcessed()).isEqualTo(7);
        assertThat(metrics.getViewCacheHits().count()).isEqualTo(1.0);
        assertThat(metrics.getViewCacheMisses().count()).isEqualTo(2.0);
        verify(jdbcTemplate, times(2)).queryForList(anyString(), any(Object[].class));
    }

    @Test
    @DisplayName("Refresh truncates then repopulates the view table")
    void refreshShouldRebuildTable() {
        when(jdbcTemplate.queryForObject(anyString(), eq(Long.class))).thenReturn(3L);

        manager.refresh("hourly_dataset_stats");

        InOrder order = inOrder(jdbcTemplate);
        order.verify(jdbcTemplate).execute("TRUNCATE TABLE IF EXISTS mv_hourly_dataset_stats");
        order.verify(jdbcTemplate).execute(ViewDefinition.HOURLY_DATASET_STATS.getPopulateSql());
        order.verify(jdbcTemplate).queryForObject("SELECT count() FROM mv_hourly_dataset_stats", Long.class);
    }

    @Test
    @DisplayName("A failing view fails the run but the other views are still refreshed")
    void refreshAllShouldContinuePastFailures() {
        doThrow(new DataAccessResourceFailureException("connection refused"))
            .when(jdbcTemplate).execute("TRUNCATE TABLE IF EXISTS mv_hourly_dataset_stats");
        when(jdbcTemplate.queryForObject(anyString(), eq(Long.class))).thenReturn(5L);

        assertThatThrownBy(() -> manager.refreshAll(JobContext.detached(JobType.VIEW_REFRESH)))
            .isInstanceOf(TransientStoreException.class)
            .hasMessage("view refresh failed");

        verify(jdbcTemplate).execute(ViewDefinition.DAILY_ENTITY_STATS.getPopulateSql());
    }

    @Test
    @DisplayName("View names are listed from the allow-list")
    void viewNamesShouldListDefinitions() {
        assertThat(manager.viewNames()).containsExactly("hourly_dataset_stats", "daily_entity_stats");
    }
}
