package com.strata.monitor;

import com.strata.config.JacksonConfig;
import com.strata.config.LifecycleProperties;
import com.strata.config.LifecycleProperties.Threshold;
import com.strata.domain.Alert;
import com.strata.domain.AlertSeverity;
import com.strata.domain.DataPoint;
import com.strata.domain.HealthStatus;
import com.strata.domain.StorageMetrics;
import com.strata.domain.StorageTier;
import com.strata.history.OperationResult;
import com.strata.scheduler.JobContext;
import com.strata.scheduler.JobType;
import com.strata.support.InMemoryTimeSeriesStore;
import com.strata.support.MutableClock;
import com.strata.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("StorageMonitor Tests")
class StorageMonitorTest {

    private static final Instant NOW = Instant.parse("2024-03-10T08:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private InMemoryTimeSeriesStore store;
    private AlertRegistry alerts;
    private StorageThresholdRepository thresholdRepository;
    private StorageMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        store = new InMemoryTimeSeriesStore();
        LifecycleProperties properties = TestProperties.under(tempDir);
        Map<StorageTier, Threshold> thresholds = new EnumMap<>(StorageTier.class);
        thresholds.put(StorageTier.HOT, new Threshold(1_000, 2_000));
        thresholds.put(StorageTier.WARM, new Threshold(10_000, 20_000));
        properties.getMonitor().setThresholds(thresholds);
        alerts = new AlertRegistry(clock, TestProperties.metrics(), 10);
        thresholdRepository = new StorageThresholdRepository(properties.getDirectories().getConfig(),
            JacksonConfig.createObjectMapper());
        monitor = new StorageMonitor(store, alerts, thresholdRepository, properties, clock, TestProperties.metrics());
    }

    @Test
    @DisplayName("Measure reports bytes and rows for the hot and warm tiers")
    void measureShouldReportStoreTiers() {
        store.write(List.of(
            DataPoint.raw("cpu", "host-1", NOW.minusSeconds(10), 1),
            DataPoint.raw("cpu", "host-1", NOW.minusSeconds(5), 2)));
        store.setSize(StorageTier.HOT, 500);

        List<StorageMetrics> measured = monitor.measure();

        assertThat(measured).extracting(StorageMetrics::getTier)
            .containsExactly(StorageTier.HOT, StorageTier.WARM);
        assertThat(measured.get(0).getBytesUsed()).isEqualTo(500);
        assertThat(measured.get(0).getRowCount()).isEqualTo(2);
        assertThat(measured.get(0).getGrowthRate()).isZero();
        assertThat(monitor.latestMetrics()).hasSize(2);
    }

    @Test
    @DisplayName("Growth rate is bytes per hour since the previous measurement")
    void growthRateShouldBePerHour() {
        store.setSize(StorageTier.HOT, 1_000);
        monitor.measure();
        clock.advance(Duration.ofMinutes(30));
        store.setSize(StorageTier.HOT, 1_600);

        StorageMetrics hot = monitor.measure().get(0);

        assertThat(hot.getGrowthRate()).isCloseTo(1_200.0, within(0.001));
    }

    @Test
    @DisplayName("Checking the same metrics twice keeps a single alert")
    void checkShouldBeIdempotent() {
        store.setSize(StorageTier.HOT, 1_500);
        List<StorageMetrics> measured = monitor.measure();

        List<Alert> first = monitor.check(measured);
        List<Alert> second = monitor.check(measured);

        assertThat(first).hasSize(1);
        assertThat(second).hasSize(1);
        assertThat(second.get(0).getId()).isEqualTo(first.get(0).getId());
        assertThat(second.get(0).getSeverity()).isEqualTo(AlertSeverity.WARNING);
        assertThat(second.get(0).getTier()).isEqualTo(StorageTier.HOT);
        assertThat(second.get(0).getSource()).isEqualTo(StorageMonitor.SOURCE);
    }

    @Test
    @DisplayName("Crossing the critical threshold replaces the warning alert")
    void checkShouldEscalateToCritical() {
        // Given
        store.setSize(StorageTier.HOT, 1_500);
        Alert warning = monitor.check(monitor.measure()).get(0);

        // When
        store.setSize(StorageTier.HOT, 2_500);
        List<Alert> active = monitor.check(monitor.measure());

        // Then
        assertThat(active).hasSize(1);
        assertThat(active.get(0).getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(warning.isResolved()).isTrue();
        assertThat(monitor.health()).isEqualTo(HealthStatus.CRITICAL);
    }

    @Test
    @DisplayName("Dropping below the warning threshold resolves the alert")
    void checkShouldResolveOnRecovery() {
        store.setSize(StorageTier.HOT, 1_500);
        monitor.check(monitor.measure());
        assertThat(monitor.health()).isEqualTo(HealthStatus.WARNING);

        store.setSize(StorageTier.HOT, 100);
        List<Alert> active = monitor.check(monitor.measure());

        assertThat(active).isEmpty();
        assertThat(monitor.health()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(alerts.resolved()).hasSize(1);
        assertThat(alerts.resolved().get(0).getResolvedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("The operator thresholds file overrides configured values")
    void thresholdsFileShouldOverrideDefaults() {
        thresholdRepository.save(Map.of(StorageTier.HOT, new Threshold(100, 200)));
        store.setSize(StorageTier.HOT, 300);

        List<Alert> active = monitor.check(monitor.measure());

        assertThat(monitor.effectiveThresholds().get(StorageTier.HOT).getCriticalBytes()).isEqualTo(200);
        assertThat(monitor.effectiveThresholds().get(StorageTier.WARM).getWarningBytes()).isEqualTo(10_000);
        assertThat(active).extracting(Alert::getSeverity).containsExactly(AlertSeverity.CRITICAL);
    }

    @Test
    @DisplayName("Health looks at alerts from every source")
    void healthShouldConsiderJobAlerts() {
        alerts.raise("job:cleanup", AlertSeverity.CRITICAL, "cleanup failed", null, "scheduler");

        assertThat(monitor.activeAlerts()).isEmpty();
        assertThat(monitor.health()).isEqualTo(HealthStatus.CRITICAL);
    }

    @Test
    @DisplayName("Scheduled run measures and checks in one pass")
    void runShouldMeasureAndCheck() {
        store.setSize(StorageTier.WARM, 15_000);

        OperationResult result = monitor.run(JobContext.detached(JobType.STORAGE_CHECK));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getItemsProcessed()).isEqualTo(2);
        assertThat(monitor.activeAlerts()).extracting(Alert::getTier).containsExactly(StorageTier.WARM);
    }
}
