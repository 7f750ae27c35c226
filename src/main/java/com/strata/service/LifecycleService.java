package com.strata.service;

import com.strata.backup.BackupInfo;
import com.strata.backup.BackupManifest;
import com.strata.backup.BackupService;
import com.strata.backup.RecoveryAttempt;
import com.strata.compression.CompressionService;
import com.strata.domain.Alert;
import com.strata.domain.HealthStatus;
import com.strata.error.NotFoundException;
import com.strata.history.OperationResult;
import com.strata.monitor.AlertRegistry;
import com.strata.monitor.StorageMonitor;
import com.strata.policy.RetentionPolicy;
import com.strata.policy.RetentionPolicyStore;
import com.strata.scheduler.JobType;
import com.strata.scheduler.LifecycleScheduler;
import com.strata.scheduler.ScheduledJob;
import com.strata.storage.cold.ArchivalResult;
import com.strata.storage.cold.ArchivalService;
import com.strata.view.MaterializedViewManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for operators and any outer transport.
 *
 * Reads go straight to the owning component. Everything that changes live
 * policies or data goes through the scheduler's exclusion lock so it never
 * interleaves with a running cleanup, archive or restore.
 */
@Service
public class LifecycleService {
    private static final Logger logger = LoggerFactory.getLogger(LifecycleService.class);

    private final LifecycleScheduler scheduler;
    private final RetentionPolicyStore policyStore;
    private final BackupService backupService;
    private final ArchivalService archivalService;
    private final StorageMonitor storageMonitor;
    private final AlertRegistry alerts;
    private final CompressionService compressionService;
    private final MaterializedViewManager views;

    public LifecycleService(LifecycleScheduler scheduler, RetentionPolicyStore policyStore,
                            BackupService backupService, ArchivalService archivalService,
                            StorageMonitor storageMonitor, AlertRegistry alerts,
                            CompressionService compressionService, MaterializedViewManager views) {
        this.scheduler = scheduler;
        this.policyStore = policyStore;
        this.backupService = backupService;
        this.archivalService = archivalService;
        this.storageMonitor = storageMonitor;
        this.alerts = alerts;
        this.compressionService = compressionService;
        this.views = views;
    }

    // Scheduler

    public boolean trigger(JobType type) {
        return scheduler.trigger(type);
    }

    public List<ScheduledJob> status() {
        return scheduler.status();
    }

    public List<OperationResult> history(JobType type) {
        return scheduler.history(type);
    }

    // Policies

    public RetentionPolicy addPolicy(RetentionPolicy policy) {
        return scheduler.runExclusive(JobType.POLICY_MUTATION, context -> policyStore.add(policy));
    }

    public RetentionPolicy updatePolicy(RetentionPolicy policy) {
        return scheduler.runExclusive(JobType.POLICY_MUTATION, context -> policyStore.update(policy));
    }

    public RetentionPolicy setPolicyEnabled(String name, boolean enabled) {
        return scheduler.runExclusive(JobType.POLICY_MUTATION, context -> policyStore.setEnabled(name, enabled));
    }

    public void removePolicy(String name) {
        scheduler.runExclusive(JobType.POLICY_MUTATION, context -> {
            policyStore.remove(name);
            return null;
        });
        logger.info("Removed retention policy {}", name);
    }

    public List<RetentionPolicy> listPolicies() {
        return policyStore.list();
    }

    public RetentionPolicy getPolicy(String name) {
        return policyStore.get(name)
            .orElseThrow(() -> new NotFoundException("policy", name));
    }

    // Alerts

    public List<Alert> activeAlerts() {
        return alerts.active();
    }

    /**
     * Active alerts first, then resolved ones still in history.
     */
    public List<Alert> listAlerts() {
        return alerts.all();
    }

    // Backups

    public BackupManifest createBackup() {
        BackupInfo info = scheduler.runExclusive(JobType.BACKUP, context -> backupService.createBackup(context));
        return info.getManifest();
    }

    public RecoveryAttempt restoreBackup(String backupId) {
        return scheduler.triggerRestore(backupId);
    }

    public List<BackupManifest> listBackups() {
        return backupService.list();
    }

    // Archives

    public List<String> listArchives(String dataset) {
        return archivalService.listArchives(dataset);
    }

    /**
     * Rehydrate an archived batch into the store. Writes live data, so it runs
     * with the other destructive operations.
     */
    public ArchivalResult restoreArchive(String key) {
        return scheduler.runExclusive(JobType.RESTORE, context -> archivalService.restoreArchive(key));
    }

    // Views

    public List<Map<String, Object>> queryView(String viewName, Map<String, String> filters) {
        return views.query(viewName, filters);
    }

    public OperationResult refreshView(String viewName) {
        return scheduler.runExclusive(JobType.VIEW_REFRESH, context -> views.refresh(viewName));
    }

    public List<String> viewNames() {
        return views.viewNames();
    }

    // Health

    public HealthStatus health() {
        return storageMonitor.health();
    }

    public Map<String, Object> statistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("health", health());
        stats.put("policies", policyStore.statistics());
        stats.put("compression", compressionService.statistics());
        stats.put("backups", backupService.statistics());
        stats.put("storage", storageMonitor.latestMetrics());
        stats.put("active_alerts", alerts.active().size());

        Map<String, Object> jobs = new LinkedHashMap<>();
        for (ScheduledJob job : scheduler.status()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("state", job.getState());
            entry.put("last_run_at", job.getLastRunAt());
            entry.put("next_due_at", job.getNextDueAt());
            entry.put("consecutive_failures", job.getConsecutiveFailures());
            jobs.put(job.getJobType().name().toLowerCase(), entry);
        }
        stats.put("jobs", jobs);
        return stats;
    }
}
