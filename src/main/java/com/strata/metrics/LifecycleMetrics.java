package com.strata.metrics;

import com.strata.domain.StorageTier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics collector for lifecycle operations.
 * Tracks job runs and failures, rows moved between tiers, archive and backup
 * volume, per-tier storage usage and view cache efficiency.
 */
@Component
public class LifecycleMetrics {

    private final MeterRegistry meterRegistry;

    private Counter rowsDownsampled;
    private Counter aggregatesWritten;
    private Counter rowsDeleted;
    private Counter rowsArchived;
    private Counter archiveBytesUploaded;
    private Counter backupsCreated;
    private Counter restoresCompleted;
    private Counter restoresFailed;
    private Counter alertsRaised;
    private Counter viewCacheHits;
    private Counter viewCacheMisses;
    private DistributionSummary compressionRatio;

    private final Map<StorageTier, AtomicLong> tierBytes = new EnumMap<>(StorageTier.class);

    public LifecycleMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        rowsDownsampled = Counter.builder("strata.transition.rows.downsampled")
            .description("Hot rows folded into warm aggregates")
            .register(meterRegistry);

        aggregatesWritten = Counter.builder("strata.transition.aggregates.written")
            .description("Warm aggregates written by downsampling")
            .register(meterRegistry);

        rowsDeleted = Counter.builder("strata.transition.rows.deleted")
            .description("Rows removed by delete policies")
            .register(meterRegistry);

        rowsArchived = Counter.builder("strata.archive.rows")
            .description("Rows moved to the cold tier")
            .register(meterRegistry);

        archiveBytesUploaded = Counter.builder("strata.archive.bytes.uploaded")
            .description("Compressed bytes uploaded to object storage")
            .baseUnit("bytes")
            .register(meterRegistry);

        backupsCreated = Counter.builder("strata.backup.created")
            .description("Backups written")
            .register(meterRegistry);

        restoresCompleted = Counter.builder("strata.backup.restore.completed")
            .description("Successful restores")
            .register(meterRegistry);

        restoresFailed = Counter.builder("strata.backup.restore.failed")
            .description("Failed restores")
            .register(meterRegistry);

        alertsRaised = Counter.builder("strata.alerts.raised")
            .description("Alerts raised by the monitor and the scheduler")
            .register(meterRegistry);

        viewCacheHits = Counter.builder("strata.view.cache.hits")
            .description("Materialized view queries served from cache")
            .register(meterRegistry);

        viewCacheMisses = Counter.builder("strata.view.cache.misses")
            .description("Materialized view queries sent to the store")
            .register(meterRegistry);

        compressionRatio = DistributionSummary.builder("strata.compression.ratio")
            .description("Compressed size divided by original size")
            .publishPercentiles(0.5, 0.95)
            .register(meterRegistry);

        for (StorageTier tier : StorageTier.values()) {
            if (!tier.isStoreResident()) {
                continue;
            }
            AtomicLong bytes = new AtomicLong();
            tierBytes.put(tier, bytes);
            Gauge.builder("strata.storage.bytes", bytes, AtomicLong::get)
                .description("Bytes used per tier at the last measurement")
                .tag("tier", tier.getValue())
                .baseUnit("bytes")
                .register(meterRegistry);
        }
    }

    public void recordJobRun(String jobType, boolean success, Duration duration) {
        Timer.builder("strata.job.duration")
            .description("Duration of lifecycle job runs")
            .tag("job", jobType)
            .tag("outcome", success ? "success" : "failure")
            .register(meterRegistry)
            .record(duration);
    }

    public void recordJobRetry(String jobType) {
        meterRegistry.counter("strata.job.retries", "job", jobType).increment();
    }

    public void recordJobTimeout(String jobType) {
        meterRegistry.counter("strata.job.timeouts", "job", jobType).increment();
    }

    public void recordJobBusy(String jobType) {
        meterRegistry.counter("strata.job.busy", "job", jobType).increment();
    }

    public void recordDownsample(long sourceRows, long aggregates) {
        rowsDownsampled.increment(sourceRows);
        aggregatesWritten.increment(aggregates);
    }

    public void recordRowsDeleted(long rows) {
        if (rows > 0) {
            rowsDeleted.increment(rows);
        }
    }

    public void recordArchived(long rows, long bytes) {
        rowsArchived.increment(rows);
        archiveBytesUploaded.increment(bytes);
    }

    public void recordBackupCreated() {
        backupsCreated.increment();
    }

    public void recordRestore(boolean success) {
        if (success) {
            restoresCompleted.increment();
        } else {
            restoresFailed.increment();
        }
    }

    public void recordAlertRaised() {
        alertsRaised.increment();
    }

    public void recordViewCacheHit() {
        viewCacheHits.increment();
    }

    public void recordViewCacheMiss() {
        viewCacheMisses.increment();
    }

    public void recordCompressionRatio(double ratio) {
        compressionRatio.record(ratio);
    }

    public void recordTierBytes(StorageTier tier, long bytes) {
        AtomicLong gauge = tierBytes.get(tier);
        if (gauge != null) {
            gauge.set(bytes);
        }
    }

    // Getter methods for testing

    public Counter getRowsDownsampled() {
        return rowsDownsampled;
    }

    public Counter getAggregatesWritten() {
        return aggregatesWritten;
    }

    public Counter getRowsDeleted() {
        return rowsDeleted;
    }

    public Counter getRowsArchived() {
        return rowsArchived;
    }

    public Counter getArchiveBytesUploaded() {
        return archiveBytesUploaded;
    }

    public Counter getBackupsCreated() {
        return backupsCreated;
    }

    public Counter getRestoresCompleted() {
        return restoresCompleted;
    }

    public Counter getRestoresFailed() {
        return restoresFailed;
    }

    public Counter getAlertsRaised() {
        return alertsRaised;
    }

    public Counter getViewCacheHits() {
        return viewCacheHits;
    }

    public Counter getViewCacheMisses() {
        return viewCacheMisses;
    }

    public DistributionSummary getCompressionRatio() {
        return compressionRatio;
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
}
