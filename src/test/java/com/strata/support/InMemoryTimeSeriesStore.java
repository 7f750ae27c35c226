package com.strata.support;

import com.strata.domain.DataPoint;
import com.strata.domain.DatasetSelector;
import com.strata.domain.StorageTier;
import com.strata.domain.TimeRange;
import com.strata.error.TransientStoreException;
import com.strata.storage.TimeSeriesStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Store fake keeping rows per tier in memory, with switches to make writes or
 * deletes fail.
 */
public class InMemoryTimeSeriesStore implements TimeSeriesStore {

    private final Map<StorageTier, List<DataPoint>> rows = new EnumMap<>(StorageTier.class);
    private final Map<StorageTier, Long> sizes = new EnumMap<>(StorageTier.class);

    private volatile boolean failWrites;
    private final AtomicInteger writesToFail = new AtomicInteger();
    private volatile boolean failDeletes;
    private volatile Runnable afterWrite = () -> { };

    public InMemoryTimeSeriesStore() {
        rows.put(StorageTier.HOT, new ArrayList<>());
        rows.put(StorageTier.WARM, new ArrayList<>());
    }

    @Override
    public synchronized List<DataPoint> query(StorageTier tier, TimeRange range, DatasetSelector selector) {
        return rows.get(tier).stream()
            .filter(p -> range.contains(p.getTimestamp()) && selector.matches(p.getDataset()))
            .sorted(Comparator.comparing(DataPoint::getTimestamp))
            .collect(Collectors.toList());
    }

    @Override
    public void write(List<DataPoint> points) {
        synchronized (this) {
            if (failWrites || writesToFail.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw new TransientStoreException("store write failed");
            }
            for (DataPoint point : points) {
                rows.get(point.getTier()).add(point);
            }
        }
        afterWrite.run();
    }

    @Override
    public synchronized long delete(StorageTier tier, TimeRange range, DatasetSelector selector) {
        if (failDeletes) {
            throw new TransientStoreException("store delete failed");
        }
        long removed = 0;
        Iterator<DataPoint> it = rows.get(tier).iterator();
        while (it.hasNext()) {
            DataPoint p = it.next();
            if (range.contains(p.getTimestamp()) && selector.matches(p.getDataset())) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    @Override
    public synchronized long deleteSeries(StorageTier tier, TimeRange range, String dataset, String entityId) {
        if (failDeletes) {
            throw new TransientStoreException("store delete failed");
        }
        long removed = 0;
        Iterator<DataPoint> it = rows.get(tier).iterator();
        while (it.hasNext()) {
            DataPoint p = it.next();
            if (range.contains(p.getTimestamp()) && p.getDataset().equals(dataset)
                    && p.getEntityId().equals(entityId)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    @Override
    public synchronized Optional<Instant> oldestTimestamp(StorageTier tier, DatasetSelector selector) {
        return rows.get(tier).stream()
            .filter(p -> selector.matches(p.getDataset()))
            .map(DataPoint::getTimestamp)
            .min(Comparator.naturalOrder());
    }

    @Override
    public synchronized long count(StorageTier tier, TimeRange range, DatasetSelector selector) {
        return query(tier, range, selector).size();
    }

    @Override
    public synchronized long sizeInBytes(StorageTier tier) {
        Long size = sizes.get(tier);
        return size != null ? size : rows.get(tier).size() * 64L;
    }

    public synchronized List<DataPoint> all(StorageTier tier) {
        return new ArrayList<>(rows.get(tier));
    }

    public synchronized void setSize(StorageTier tier, long bytes) {
        sizes.put(tier, bytes);
    }

    public void setFailWrites(boolean failWrites) {
        this.failWrites = failWrites;
    }

    /**
     * Make only the next {@code count} writes fail.
     */
    public void failNextWrites(int count) {
        writesToFail.set(count);
    }

    public void setFailDeletes(boolean failDeletes) {
        this.failDeletes = failDeletes;
    }

    /**
     * Hook run after every successful write, outside the store's lock.
     */
    public void setAfterWrite(Runnable afterWrite) {
        this.afterWrite = afterWrite;
    }
}
