package com.strata.storage;

import com.strata.domain.DataPoint;
import com.strata.domain.DatasetSelector;
import com.strata.domain.StorageTier;
import com.strata.domain.TimeRange;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Opaque read/write/delete access to the time-series store.
 *
 * Implementations map store failures to
 * {@link com.strata.error.TransientStoreException}. Deletes are always range
 * predicates, never per-row.
 */
public interface TimeSeriesStore {

    /**
     * Rows of {@code tier} with timestamp in {@code range} whose dataset matches
     * {@code selector}, ordered by timestamp.
     */
    List<DataPoint> query(StorageTier tier, TimeRange range, DatasetSelector selector);

    /**
     * Write rows; every row is written to the tier it declares.
     */
    void write(List<DataPoint> rows);

    /**
     * Delete rows of {@code tier} in {@code range} matching {@code selector}.
     *
     * @return number of rows removed, or -1 when the store cannot tell
     */
    long delete(StorageTier tier, TimeRange range, DatasetSelector selector);

    /**
     * Delete rows of {@code tier} in {@code range} belonging to one series.
     *
     * @return number of rows removed, or -1 when the store cannot tell
     */
    long deleteSeries(StorageTier tier, TimeRange range, String dataset, String entityId);

    Optional<Instant> oldestTimestamp(StorageTier tier, DatasetSelector selector);

    /**
     * Oldest timestamp across the hot and warm tiers.
     */
    default Optional<Instant> oldestTimestamp(DatasetSelector selector) {
        Optional<Instant> hot = oldestTimestamp(StorageTier.HOT, selector);
        Optional<Instant> warm = oldestTimestamp(StorageTier.WARM, selector);
        if (hot.isEmpty()) {
            return warm;
        }
        if (warm.isEmpty()) {
            return hot;
        }
        return Optional.of(hot.get().isBefore(warm.get()) ? hot.get() : warm.get());
    }

    long count(StorageTier tier, TimeRange range, DatasetSelector selector);

    /**
     * Bytes the tier occupies on disk.
     */
    long sizeInBytes(StorageTier tier);
}
