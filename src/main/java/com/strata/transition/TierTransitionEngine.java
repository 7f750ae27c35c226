package com.strata.transition;

import com.strata.config.LifecycleProperties;
import com.strata.domain.DataPoint;
import com.strata.domain.DatasetSelector;
import com.strata.domain.StatisticKind;
import com.strata.domain.StorageTier;
import com.strata.domain.TimeRange;
import com.strata.error.ErrorSummaries;
import com.strata.error.LifecycleException;
import com.strata.history.BoundedHistory;
import com.strata.metrics.LifecycleMetrics;
import com.strata.policy.PolicyAction;
import com.strata.policy.RetentionPolicy;
import com.strata.policy.RetentionPolicyStore;
import com.strata.policy.TierWindow;
import com.strata.scheduler.JobContext;
import com.strata.storage.TimeSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;

/**
 * Moves data down the tiers: hot rows older than a DOWNSAMPLE policy's
 * retention are folded into warm bucket aggregates, and DELETE policies
 * range-delete hot and warm rows past their retention.
 *
 * Work is cut into bounded chunks processed oldest first. A downsampled chunk
 * loses its hot rows only after its aggregates were written. Late rows are
 * merged into the stored aggregate of their series and bucket; other series
 * are never touched.
 */
@Service
public class TierTransitionEngine {
    private static final Logger logger = LoggerFactory.getLogger(TierTransitionEngine.class);

    private final TimeSeriesStore store;
    private final RetentionPolicyStore policyStore;
    private final Clock clock;
    private final LifecycleMetrics metrics;
    private final Duration bucket;
    private final Duration chunk;
    private final BoundedHistory<CleanupResult> history;

    public TierTransitionEngine(TimeSeriesStore store, RetentionPolicyStore policyStore,
                                LifecycleProperties properties, Clock clock, LifecycleMetrics metrics) {
        this.store = store;
        this.policyStore = policyStore;
        this.clock = clock;
        this.metrics = metrics;
        properties.getTransition().validate();
        this.bucket = properties.getTransition().getBucket();
        this.chunk = properties.getTransition().getChunk();
        this.history = new BoundedHistory<>(properties.getHistoryCapacity());
    }

    /**
     * Evaluate every enabled DOWNSAMPLE and DELETE policy once.
     *
     * A failing policy does not stop the others, but the run as a whole fails
     * with the first error so the scheduler retries it.
     */
    public CleanupResult run(JobContext context) {
        Instant now = clock.instant();
        CleanupResult result = new CleanupResult(now);
        LifecycleException firstFailure = null;

        List<RetentionPolicy> policies = new ArrayList<>(policyStore.enabled(PolicyAction.DOWNSAMPLE));
        policies.addAll(policyStore.enabled(PolicyAction.DELETE));
        logger.info("Starting tier transition for {} policies", policies.size());

        try {
            for (RetentionPolicy policy : policies) {
                context.throwIfCancelled();
                result.policyEvaluated();
                try {
                    TierWindow window = policyStore.windowFor(policy, now);
                    if (policy.getAction() == PolicyAction.DOWNSAMPLE) {
                        downsample(policy, window, context, result);
                    } else {
                        deleteExpired(policy, window, context, result);
                    }
                } catch (LifecycleException e) {
                    logger.error("Tier transition failed for policy {}: {}", policy.getName(),
                        ErrorSummaries.summarize(e), e);
                    result.policyFailed(policy.getName());
                    if (firstFailure == null) {
                        firstFailure = e;
                    }
                }
            }
        } catch (CancellationException e) {
            result.fail(clock.instant(), "TIMEOUT: cleanup cancelled");
            history.append(result);
            throw e;
        }

        if (firstFailure != null) {
            result.fail(clock.instant(), firstFailure);
            history.append(result);
            throw firstFailure;
        }
        result.succeed(clock.instant());
        history.append(result);
        logger.info("Tier transition finished: {} rows downsampled into {} aggregates, {} rows deleted",
            result.getRowsDownsampled(), result.getAggregatesWritten(), result.getRowsDeleted());
        return result;
    }

    private void downsample(RetentionPolicy policy, TierWindow window, JobContext context, CleanupResult result) {
        DatasetSelector selector = policy.selector();
        Instant end = floor(window.getHotCutoff(), bucket);
        Optional<Instant> oldest = store.oldestTimestamp(StorageTier.HOT, selector);
        if (oldest.isEmpty()) {
            return;
        }
        Instant start = floor(max(window.getWarmCutoff(), oldest.get()), bucket);
        if (!start.isBefore(end)) {
            return;
        }

        for (TimeRange range : TimeRange.of(start, end).split(chunk)) {
            context.throwIfCancelled();
            downsampleChunk(policy, selector, range, context, result);
            result.chunkProcessed();
        }
    }

    private void downsampleChunk(RetentionPolicy policy, DatasetSelector selector, TimeRange range,
                                 JobContext context, CleanupResult result) {
        List<DataPoint> raw = store.query(StorageTier.HOT, range, selector);
        if (raw.isEmpty()) {
            return;
        }
        List<DataPoint> aggregates = aggregate(raw, policy.getStatisticKind(), bucket);
        Map<SeriesKey, TimeRange> touched = touchedRanges(aggregates);
        List<DataPoint> previous = existingAggregates(touched, selector);
        List<DataPoint> merged = merge(previous, aggregates, policy.getStatisticKind());

        try {
            replaceWarm(touched, merged);
        } catch (RuntimeException e) {
            rollBackWarm(touched, previous, e);
            throw e;
        }

        if (context.isCancelled()) {
            CancellationException cancelled =
                new CancellationException("cleanup cancelled before source delete of " + range);
            rollBackWarm(touched, previous, cancelled);
            throw cancelled;
        }

        try {
            store.delete(StorageTier.HOT, range, selector);
        } catch (RuntimeException e) {
            rollBackWarm(touched, previous, e);
            throw e;
        }
        result.addDownsampled(raw.size(), aggregates.size());
        metrics.recordDownsample(raw.size(), aggregates.size());
        logger.debug("Policy {} downsampled {} rows into {} aggregates for {}",
            policy.getName(), raw.size(), aggregates.size(), range);
    }

    /**
     * Per series, the bucket range its new aggregates fall into.
     */
    private Map<SeriesKey, TimeRange> touchedRanges(List<DataPoint> aggregates) {
        Map<SeriesKey, Instant[]> bounds = new LinkedHashMap<>();
        for (DataPoint aggregate : aggregates) {
            Instant start = aggregate.getTimestamp();
            Instant[] span = bounds.computeIfAbsent(new SeriesKey(aggregate.getDataset(), aggregate.getEntityId()),
                k -> new Instant[] {start, start});
            if (start.isBefore(span[0])) {
                span[0] = start;
            }
            if (start.isAfter(span[1])) {
                span[1] = start;
            }
        }
        Map<SeriesKey, TimeRange> ranges = new LinkedHashMap<>();
        for (Map.Entry<SeriesKey, Instant[]> entry : bounds.entrySet()) {
            ranges.put(entry.getKey(), TimeRange.of(entry.getValue()[0], entry.getValue()[1].plus(bucket)));
        }
        return ranges;
    }

    /**
     * Warm rows already stored inside the touched range of each touched series.
     */
    private List<DataPoint> existingAggregates(Map<SeriesKey, TimeRange> touched, DatasetSelector selector) {
        Instant start = null;
        Instant end = null;
        for (TimeRange range : touched.values()) {
            start = start == null || range.getStart().isBefore(start) ? range.getStart() : start;
            end = end == null || range.getEnd().isAfter(end) ? range.getEnd() : end;
        }
        List<DataPoint> existing = new ArrayList<>();
        for (DataPoint point : store.query(StorageTier.WARM, TimeRange.of(start, end), selector)) {
            TimeRange range = touched.get(new SeriesKey(point.getDataset(), point.getEntityId()));
            if (range != null && range.contains(point.getTimestamp())) {
                existing.add(point);
            }
        }
        return existing;
    }

    /**
     * Fold new aggregates into the stored ones of the same (dataset, entity,
     * bucket). Stored rows without a new counterpart are carried over as is.
     */
    static List<DataPoint> merge(List<DataPoint> existing, List<DataPoint> aggregates, StatisticKind kind) {
        Map<BucketKey, DataPoint> byKey = new TreeMap<>();
        List<DataPoint> all = new ArrayList<>(existing);
        all.addAll(aggregates);
        for (DataPoint point : all) {
            BucketKey key = new BucketKey(point.getDataset(), point.getEntityId(), point.getTimestamp());
            DataPoint current = byKey.get(key);
            if (current == null) {
                byKey.put(key, point);
            } else {
                byKey.put(key, new DataPoint(StorageTier.WARM, key.dataset, key.entityId, key.bucketStart,
                    kind.merge(current.getValue(), current.getSampleCount(), point.getValue(), point.getSampleCount()),
                    current.getSampleCount() + point.getSampleCount(),
                    Math.min(current.getMin(), point.getMin()),
                    Math.max(current.getMax(), point.getMax())));
            }
        }
        return new ArrayList<>(byKey.values());
    }

    private void replaceWarm(Map<SeriesKey, TimeRange> touched, List<DataPoint> rows) {
        for (Map.Entry<SeriesKey, TimeRange> entry : touched.entrySet()) {
            store.deleteSeries(StorageTier.WARM, entry.getValue(), entry.getKey().dataset, entry.getKey().entityId);
        }
        if (!rows.isEmpty()) {
            store.write(rows);
        }
    }

    /**
     * Put the touched series back to the aggregates stored before this chunk.
     */
    private void rollBackWarm(Map<SeriesKey, TimeRange> touched, List<DataPoint> previous, Exception cause) {
        try {
            replaceWarm(touched, previous);
        } catch (RuntimeException e) {
            logger.error("Could not restore {} warm aggregates of {} series after a failed chunk",
                previous.size(), touched.size(), e);
            cause.addSuppressed(e);
        }
    }

    private void deleteExpired(RetentionPolicy policy, TierWindow window, JobContext context, CleanupResult result) {
        DatasetSelector selector = policy.selector();
        Instant end = window.getWarmCutoff();
        Optional<Instant> oldest = store.oldestTimestamp(selector);
        if (oldest.isEmpty() || !oldest.get().isBefore(end)) {
            return;
        }

        for (TimeRange range : TimeRange.of(oldest.get(), end).split(chunk)) {
            context.throwIfCancelled();
            long deleted = store.delete(StorageTier.HOT, range, selector)
                + store.delete(StorageTier.WARM, range, selector);
            result.addDeleted(deleted);
            result.chunkProcessed();
            metrics.recordRowsDeleted(deleted);
        }
        logger.debug("Policy {} deleted rows before {}", policy.getName(), end);
    }

    /**
     * Group raw rows by (dataset, entity, bucket start) and fold each group with
     * the policy's statistic kind.
     */
    static List<DataPoint> aggregate(List<DataPoint> raw, StatisticKind kind, Duration bucket) {
        Map<BucketKey, List<DataPoint>> groups = new TreeMap<>();
        for (DataPoint point : raw) {
            BucketKey key = new BucketKey(point.getDataset(), point.getEntityId(), floor(point.getTimestamp(), bucket));
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(point);
        }

        List<DataPoint> aggregates = new ArrayList<>(groups.size());
        for (Map.Entry<BucketKey, List<DataPoint>> group : groups.entrySet()) {
            List<Double> values = new ArrayList<>(group.getValue().size());
            long samples = 0;
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (DataPoint point : group.getValue()) {
                values.add(point.getValue());
                samples += point.getSampleCount();
                min = Math.min(min, point.getMin());
                max = Math.max(max, point.getMax());
            }
            BucketKey key = group.getKey();
            aggregates.add(new DataPoint(StorageTier.WARM, key.dataset, key.entityId, key.bucketStart,
                kind.aggregate(values), samples, min, max));
        }
        return aggregates;
    }

    static Instant floor(Instant instant, Duration width) {
        long millis = width.toMillis();
        return Instant.ofEpochMilli(Math.floorDiv(instant.toEpochMilli(), millis) * millis);
    }

    private static Instant max(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }

    public List<CleanupResult> history() {
        return history.snapshot();
    }

    private static final class SeriesKey {
        private final String dataset;
        private final String entityId;

        private SeriesKey(String dataset, String entityId) {
            this.dataset = dataset;
            this.entityId = entityId;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof SeriesKey)) {
                return false;
            }
            SeriesKey other = (SeriesKey) o;
            return dataset.equals(other.dataset) && entityId.equals(other.entityId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(dataset, entityId);
        }
    }

    private static final class BucketKey implements Comparable<BucketKey> {
        private final String dataset;
        private final String entityId;
        private final Instant bucketStart;

        private BucketKey(String dataset, String entityId, Instant bucketStart) {
            this.dataset = dataset;
            this.entityId = entityId;
            this.bucketStart = bucketStart;
        }

        @Override
        public int compareTo(BucketKey other) {
            int byTime = bucketStart.compareTo(other.bucketStart);
            if (byTime != 0) {
                return byTime;
            }
            int byDataset = dataset.compareTo(other.dataset);
            return byDataset != 0 ? byDataset : entityId.compareTo(other.entityId);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof BucketKey)) {
                return false;
            }
            BucketKey other = (BucketKey) o;
            return dataset.equals(other.dataset) && entityId.equals(other.entityId)
                && bucketStart.equals(other.bucketStart);
        }

        @Override
        public int hashCode() {
            return Objects.hash(dataset, entityId, bucketStart);
        }
    }
}
