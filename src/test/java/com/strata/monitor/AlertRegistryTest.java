package com.strata.monitor;

import com.strata.domain.Alert;
import com.strata.domain.AlertSeverity;
import com.strata.domain.StorageTier;
import com.strata.metrics.LifecycleMetrics;
import com.strata.support.MutableClock;
import com.strata.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AlertRegistry Tests")
class AlertRegistryTest {

    private MutableClock clock;
    private LifecycleMetrics metrics;
    private AlertRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-10T08:00:00Z"));
        metrics = TestProperties.metrics();
        registry = new AlertRegistry(clock, metrics, 2);
    }

    @Test
    @DisplayName("Raising the same condition and severity returns the existing alert")
    void raiseShouldDeduplicate() {
        Alert first = registry.raise("storage:hot", AlertSeverity.WARNING, "hot is filling", StorageTier.HOT, "storage_monitor");
        Alert second = registry.raise("storage:hot", AlertSeverity.WARNING, "hot is filling", StorageTier.HOT, "storage_monitor");

        assertThat(second).isSameAs(first);
        assertThat(registry.active()).hasSize(1);
        assertThat(metrics.getAlertsRaised().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A new severity resolves the previous alert")
    void raiseShouldReplaceOnSeverityChange() {
        Alert warning = registry.raise("storage:hot", AlertSeverity.WARNING, "warn", StorageTier.HOT, "storage_monitor");
        clock.advance(Duration.ofMinutes(5));

        Alert critical = registry.raise("storage:hot", AlertSeverity.CRITICAL, "crit", StorageTier.HOT, "storage_monitor");

        assertThat(warning.getResolvedAt()).isEqualTo(clock.instant());
        assertThat(registry.activeFor("storage:hot")).contains(critical);
        assertThat(registry.resolved()).containsExactly(warning);
    }

    @Test
    @DisplayName("Resolving an unknown condition is a no-op")
    void resolveUnknownShouldBeEmpty() {
        assertThat(registry.resolve("job:backup")).isEmpty();
        assertThat(registry.all()).isEmpty();
    }

    @Test
    @DisplayName("Resolved alerts are kept in a bounded ring")
    void resolvedHistoryShouldBeBounded() {
        for (int i = 0; i < 3; i++) {
            registry.raise("job:cleanup", AlertSeverity.CRITICAL, "failure " + i, null, "scheduler");
            registry.resolve("job:cleanup");
        }
        Alert open = registry.raise("job:archive", AlertSeverity.CRITICAL, "archive failed", null, "scheduler");

        assertThat(registry.resolved()).extracting(Alert::getMessage).containsExactly("failure 1", "failure 2");
        assertThat(registry.all()).first().isSameAs(open);
        assertThat(registry.all()).hasSize(3);
    }
}
