package com.strata.service;

import com.strata.backup.BackupInfo;
import com.strata.backup.BackupManifest;
import com.strata.backup.BackupService;
import com.strata.backup.RecoveryAttempt;
import com.strata.compression.CompressionService;
import com.strata.domain.HealthStatus;
import com.strata.error.NotFoundException;
import com.strata.monitor.AlertRegistry;
import com.strata.monitor.StorageMonitor;
import com.strata.policy.PolicyAction;
import com.strata.policy.RetentionPolicy;
import com.strata.policy.RetentionPolicyStore;
import com.strata.scheduler.JobContext;
import com.strata.scheduler.JobType;
import com.strata.scheduler.LifecycleScheduler;
import com.strata.scheduler.ScheduledJob;
import com.strata.storage.cold.ArchivalService;
import com.strata.view.MaterializedViewManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("LifecycleService Tests")
class LifecycleServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-10T08:00:00Z");

    @Mock
    private LifecycleScheduler scheduler;

    @Mock
    private RetentionPolicyStore policyStore;

    @Mock
    private BackupService backupService;

    @Mock
    private ArchivalService archivalService;

    @Mock
    private StorageMonitor storageMonitor;

    @Mock
    private AlertRegistry alerts;

    @Mock
    private CompressionService compressionService;

    @Mock
    private MaterializedViewManager views;

    private LifecycleService service;

    @BeforeEach
    void setUp() {
        service = new LifecycleService(scheduler, policyStore, backupService, archivalService, storageMonitor,
            alerts, compressionService, views);
    }

    @Test
    @DisplayName("Policy changes run under the policy mutation lock")
    void addPolicyShouldRunExclusively() {
        // Given
        RetentionPolicy policy = RetentionPolicy.builder()
            .name("logs-purge").datasetSelector("logs").retention(Duration.ofDays(30)).action(PolicyAction.DELETE)
            .build();
        runExclusiveInline(JobType.POLICY_MUTATION);
        when(policyStore.add(policy)).thenReturn(policy);

        // When
        RetentionPolicy added = service.addPolicy(policy);

        // Then
        assertThat(added).isSameAs(policy);
        verify(policyStore).add(policy);
    }

    @Test
    @DisplayName("Unknown policies are reported as not found")
    void getPolicyShouldThrowWhenMissing() {
        when(policyStore.get("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getPolicy("missing")).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("On-demand backups return the manifest of the written backup")
    void createBackupShouldReturnManifest() {
        BackupManifest manifest = new BackupManifest();
        manifest.setBackupId("backup-1");
        BackupInfo info = new BackupInfo("backup-1", NOW);
        info.setManifest(manifest);
        runExclusiveInline(JobType.BACKUP);
        when(backupService.createBackup(any())).thenReturn(info);

        assertThat(service.createBackup()).isSameAs(manifest);
    }

    @Test
    @DisplayName("Restores are delegated to the scheduler")
    void restoreBackupShouldUseScheduler() {
        RecoveryAttempt attempt = new RecoveryAttempt("backup-1", NOW);
        when(scheduler.triggerRestore("backup-1")).thenReturn(attempt);

        assertThat(service.restoreBackup("backup-1")).isSameAs(attempt);
        verifyNoInteractions(backupService);
    }

    @Test
    @DisplayName("Statistics include per-job scheduling state")
    void statisticsShouldIncludeJobs() {
        ScheduledJob cleanup = new ScheduledJob(JobType.CLEANUP, Duration.ofHours(1), NOW, NOW);
        when(scheduler.status()).thenReturn(List.of(cleanup));
        when(storageMonitor.health()).thenReturn(HealthStatus.HEALTHY);
        when(alerts.active()).thenReturn(List.of());

        Map<String, Object> stats = service.statistics();

        assertThat(stats).containsEntry("health", HealthStatus.HEALTHY).containsEntry("active_alerts", 0);
        @SuppressWarnings("unchecked")
        Map<String, Object> jobs = (Map<String, Object>) stats.get("jobs");
        assertThat(jobs).containsOnlyKeys("cleanup");
        @SuppressWarnings("unchecked")
        Map<String, Object> entry = (Map<String, Object>) jobs.get("cleanup");
        assertThat(entry).containsEntry("next_due_at", NOW.plus(Duration.ofHours(1)))
            .containsEntry("consecutive_failures", 0);
    }

    @SuppressWarnings("unchecked")
    private void runExclusiveInline(JobType type) {
        when(scheduler.runExclusive(eq(type), any())).thenAnswer(invocation ->
            ((Function<JobContext, Object>) invocation.getArgument(1)).apply(JobContext.detached(type)));
    }
}
