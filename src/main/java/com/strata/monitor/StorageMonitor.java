package com.strata.monitor;

import com.strata.config.LifecycleProperties;
import com.strata.config.LifecycleProperties.Threshold;
import com.strata.domain.Alert;
import com.strata.domain.AlertSeverity;
import com.strata.domain.DatasetSelector;
import com.strata.domain.HealthStatus;
import com.strata.domain.StorageMetrics;
import com.strata.domain.StorageTier;
import com.strata.domain.TimeRange;
import com.strata.history.OperationResult;
import com.strata.metrics.LifecycleMetrics;
import com.strata.scheduler.JobContext;
import com.strata.storage.TimeSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Measures per-tier usage of the time-series store and keeps storage alerts in
 * line with the configured thresholds.
 */
@Service
public class StorageMonitor {
    private static final Logger logger = LoggerFactory.getLogger(StorageMonitor.class);

    public static final String SOURCE = "storage_monitor";

    private static final DatasetSelector ALL_DATASETS = DatasetSelector.of("*");
    private static final Instant END_OF_TIME = Instant.parse("2200-01-01T00:00:00Z");

    private final TimeSeriesStore store;
    private final AlertRegistry alerts;
    private final StorageThresholdRepository thresholdRepository;
    private final Map<StorageTier, Threshold> defaultThresholds;
    private final Clock clock;
    private final LifecycleMetrics metrics;

    private final Map<StorageTier, StorageMetrics> latest = new EnumMap<>(StorageTier.class);

    public StorageMonitor(TimeSeriesStore store, AlertRegistry alerts, StorageThresholdRepository thresholdRepository,
                          LifecycleProperties properties, Clock clock, LifecycleMetrics metrics) {
        this.store = store;
        this.alerts = alerts;
        this.thresholdRepository = thresholdRepository;
        this.defaultThresholds = properties.getMonitor().getThresholds();
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Current usage per store-resident tier. Growth rate is bytes per hour since
     * the previous measurement.
     */
    public synchronized List<StorageMetrics> measure() {
        Instant now = clock.instant();
        List<StorageMetrics> measured = new ArrayList<>();
        for (StorageTier tier : StorageTier.values()) {
            if (!tier.isStoreResident()) {
                continue;
            }
            long bytes = store.sizeInBytes(tier);
            long rows = store.count(tier, TimeRange.of(Instant.EPOCH, END_OF_TIME), ALL_DATASETS);
            StorageMetrics current = new StorageMetrics(tier, bytes, rows, growthRate(latest.get(tier), bytes, now), now);
            latest.put(tier, current);
            metrics.recordTierBytes(tier, bytes);
            measured.add(current);
        }
        logger.debug("Measured storage: {}", measured);
        return measured;
    }

    private static double growthRate(StorageMetrics previous, long bytes, Instant now) {
        if (previous == null) {
            return 0.0;
        }
        long elapsedMillis = Duration.between(previous.getMeasuredAt(), now).toMillis();
        if (elapsedMillis <= 0) {
            return 0.0;
        }
        return (bytes - previous.getBytesUsed()) * 3_600_000.0 / elapsedMillis;
    }

    /**
     * Raise, escalate or resolve storage alerts for the given measurements.
     * Checking the same metrics twice changes nothing.
     *
     * @return active storage alerts after the check
     */
    public List<Alert> check(List<StorageMetrics> measurements) {
        Map<StorageTier, Threshold> thresholds = effectiveThresholds();
        for (StorageMetrics measurement : measurements) {
            Threshold threshold = thresholds.get(measurement.getTier());
            if (threshold == null) {
                continue;
            }
            String condition = condition(measurement.getTier());
            AlertSeverity severity = severityOf(measurement.getBytesUsed(), threshold);
            if (severity == null) {
                alerts.resolve(condition);
                continue;
            }
            long limit = severity == AlertSeverity.CRITICAL ? threshold.getCriticalBytes() : threshold.getWarningBytes();
            alerts.raise(condition, severity,
                String.format("%s tier uses %d bytes, above the %s threshold of %d bytes",
                    measurement.getTier().getValue(), measurement.getBytesUsed(), severity.getValue(), limit),
                measurement.getTier(), SOURCE);
        }
        return activeAlerts();
    }

    /**
     * Scheduled entry point: measure then check.
     */
    public OperationResult run(JobContext context) {
        OperationResult result = new OperationResult("storage_check", clock.instant());
        List<StorageMetrics> measured = measure();
        context.throwIfCancelled();
        List<Alert> active = check(measured);
        result.setItemsProcessed(measured.size());
        result.succeed(clock.instant());
        logger.info("Storage check finished: {} tiers measured, {} active storage alerts", measured.size(), active.size());
        return result;
    }

    private static AlertSeverity severityOf(long bytes, Threshold threshold) {
        if (bytes >= threshold.getCriticalBytes()) {
            return AlertSeverity.CRITICAL;
        }
        if (bytes >= threshold.getWarningBytes()) {
            return AlertSeverity.WARNING;
        }
        return null;
    }

    /**
     * Configured thresholds overlaid with the operator file, re-read on every
     * call so a restored file takes effect on the next check.
     */
    public Map<StorageTier, Threshold> effectiveThresholds() {
        Map<StorageTier, Threshold> effective = new EnumMap<>(StorageTier.class);
        effective.putAll(defaultThresholds);
        effective.putAll(thresholdRepository.load());
        return effective;
    }

    public List<Alert> activeAlerts() {
        return alerts.active().stream()
            .filter(alert -> SOURCE.equals(alert.getSource()))
            .collect(Collectors.toList());
    }

    /**
     * Overall health from every active alert, not only storage ones.
     */
    public HealthStatus health() {
        HealthStatus status = HealthStatus.HEALTHY;
        for (Alert alert : alerts.active()) {
            if (alert.getSeverity() == AlertSeverity.CRITICAL) {
                return HealthStatus.CRITICAL;
            }
            status = HealthStatus.WARNING;
        }
        return status;
    }

    public synchronized List<StorageMetrics> latestMetrics() {
        return new ArrayList<>(latest.values());
    }

    static String condition(StorageTier tier) {
        return "storage:" + tier.getValue();
    }
}
