package com.strata.monitor;

import com.strata.domain.Alert;
import com.strata.domain.AlertSeverity;
import com.strata.domain.StorageTier;
import com.strata.history.BoundedHistory;
import com.strata.metrics.LifecycleMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Active alerts keyed by condition, plus a bounded ring of resolved ones.
 *
 * A condition has at most one active alert. Raising the same severity again
 * keeps the existing alert; a different severity resolves it and raises a new
 * one.
 */
public class AlertRegistry {
    private static final Logger logger = LoggerFactory.getLogger(AlertRegistry.class);

    private final Map<String, Alert> active = new LinkedHashMap<>();
    private final BoundedHistory<Alert> resolved;
    private final Clock clock;
    private final LifecycleMetrics metrics;

    public AlertRegistry(Clock clock, LifecycleMetrics metrics, int resolvedCapacity) {
        this.clock = clock;
        this.metrics = metrics;
        this.resolved = new BoundedHistory<>(resolvedCapacity);
    }

    public synchronized Alert raise(String condition, AlertSeverity severity, String message, StorageTier tier,
                                    String source) {
        Alert current = active.get(condition);
        if (current != null && current.getSeverity() == severity) {
            return current;
        }
        if (current != null) {
            retire(condition, current);
        }
        Alert alert = new Alert(severity, message, tier, source, clock.instant());
        active.put(condition, alert);
        metrics.recordAlertRaised();
        if (severity == AlertSeverity.CRITICAL) {
            logger.error("Alert raised: {}", alert);
        } else {
            logger.warn("Alert raised: {}", alert);
        }
        return alert;
    }

    /**
     * Resolve the active alert of a condition, if any.
     */
    public synchronized Optional<Alert> resolve(String condition) {
        Alert current = active.get(condition);
        if (current == null) {
            return Optional.empty();
        }
        retire(condition, current);
        logger.info("Alert resolved: {}", current);
        return Optional.of(current);
    }

    private void retire(String condition, Alert alert) {
        alert.resolve(clock.instant());
        active.remove(condition);
        resolved.append(alert);
    }

    public synchronized Optional<Alert> activeFor(String condition) {
        return Optional.ofNullable(active.get(condition));
    }

    public synchronized List<Alert> active() {
        return new ArrayList<>(active.values());
    }

    /**
     * Recently resolved alerts, oldest first.
     */
    public List<Alert> resolved() {
        return resolved.snapshot();
    }

    /**
     * Active alerts followed by recently resolved ones.
     */
    public List<Alert> all() {
        List<Alert> all = active();
        all.addAll(resolved());
        return all;
    }
}
