package com.strata.storage.clickhouse;

import com.strata.domain.DataPoint;
import com.strata.domain.DatasetSelector;
import com.strata.domain.StorageTier;
import com.strata.domain.TimeRange;
import com.strata.error.TransientStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ClickHouseTimeSeriesStore Tests")
class ClickHouseTimeSeriesStoreTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    @Mock
    private JdbcTemplate jdbcTemplate;

    private ClickHouseTimeSeriesStore store;

    @BeforeEach
    void setUp() {
        store = new ClickHouseTimeSeriesStore(jdbcTemplate);
    }

    @Test
    @DisplayName("Only hot and warm tiers map to tables")
    void tableForShouldRejectCold() {
        assertThat(ClickHouseTimeSeriesStore.tableFor(StorageTier.HOT)).isEqualTo("lifecycle_hot");
        assertThat(ClickHouseTimeSeriesStore.tableFor(StorageTier.WARM)).isEqualTo("lifecycle_warm");
        assertThatThrownBy(() -> ClickHouseTimeSeriesStore.tableFor(StorageTier.COLD))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Writes are batched per tier table")
    @SuppressWarnings("unchecked")
    void writeShouldBatchPerTier() {
        DataPoint hot = DataPoint.raw("cpu", "host-1", T0, 1.0);
        DataPoint warm = new DataPoint(StorageTier.WARM, "cpu", "host-1", T0, 2.0, 6, 1.0, 3.0);

        store.write(List.of(hot, warm, hot));

        ArgumentCaptor<List<Object[]>> hotBatch = ArgumentCaptor.forClass(List.class);
        verify(jdbcTemplate).batchUpdate(contains("INSERT INTO lifecycle_hot"),
            hotBatch.capture());
        verify(jdbcTemplate).batchUpdate(contains("INSERT INTO lifecycle_warm"),
            anyList());
        assertThat(hotBatch.getValue()).hasSize(2);
        assertThat(hotBatch.getValue().get(0)).containsExactly("cpu", "host-1", T0.toEpochMilli(), 1.0, 1L, 1.0, 1.0);
    }

    @Test
    @DisplayName("A series delete is bound to one dataset and entity")
    void deleteSeriesShouldBindDatasetAndEntity() {
        TimeRange hour = TimeRange.of(T0, T0.plusSeconds(3600));

        store.deleteSeries(StorageTier.WARM, hour, "cpu", "host-1");

        verify(jdbcTemplate).update(contains("DELETE FROM lifecycle_warm"),
            eq(T0.toEpochMilli()), eq(T0.plusSeconds(3600).toEpochMilli()), eq("cpu"), eq("host-1"));
    }

    @Test
    @DisplayName("An empty write never reaches the database")
    void emptyWriteShouldBeNoop() {
        store.write(List.of());

        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    @DisplayName("Deleting an empty range skips the delete statement")
    void deleteShouldSkipWhenNothingMatches() {
        when(jdbcTemplate.queryForObject(anyString(), eq(Long.class), any(Object[].class))).thenReturn(0L);

        long deleted = store.delete(StorageTier.HOT, TimeRange.before(T0), DatasetSelector.of("cpu"));

        assertThat(deleted).isZero();
        verify(jdbcTemplate, never()).update(anyString(), any(Object[].class));
    }

    @Test
    @DisplayName("Wildcard selectors become prefix predicates")
    void wildcardSelectorShouldUsePrefix() {
        when(jdbcTemplate.queryForObject(anyString(), eq(Long.class), any(Object[].class))).thenReturn(4L);

        long deleted = store.delete(StorageTier.WARM, TimeRange.of(T0, T0.plusSeconds(3600)), DatasetSelector.of("logs.*"));

        assertThat(deleted).isEqualTo(4);
        verify(jdbcTemplate).update(contains("startsWith(dataset, ?)"),
            eq(T0.toEpochMilli()), eq(T0.plusSeconds(3600).toEpochMilli()), eq("logs."));
    }

    @Test
    @DisplayName("Database failures surface as transient store errors")
    void failuresShouldBeTransient() {
        when(jdbcTemplate.queryForObject(anyString(), eq(Long.class), any(Object[].class)))
            .thenThrow(new DataAccessResourceFailureException("Connection refused"));

        assertThatThrownBy(() -> store.count(StorageTier.HOT, TimeRange.before(T0), DatasetSelector.of("*")))
            .isInstanceOf(TransientStoreException.class)
            .hasMessage("time-series store count failed on hot tier");
    }
}
