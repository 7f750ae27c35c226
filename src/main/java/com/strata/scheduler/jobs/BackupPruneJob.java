package com.strata.scheduler.jobs;

import com.strata.backup.BackupService;
import com.strata.config.LifecycleProperties;
import com.strata.history.OperationResult;
import com.strata.scheduler.JobContext;
import com.strata.scheduler.JobType;
import com.strata.scheduler.LifecycleJob;
import org.springframework.stereotype.Component;

/**
 * Keeps only the configured number of most recent backups.
 */
@Component
public class BackupPruneJob implements LifecycleJob {

    private final BackupService backupService;
    private final int keep;

    public BackupPruneJob(BackupService backupService, LifecycleProperties properties) {
        this.backupService = backupService;
        this.keep = properties.getBackup().getKeep();
    }

    @Override
    public JobType type() {
        return JobType.BACKUP_PRUNE;
    }

    @Override
    public OperationResult run(JobContext context) {
        context.throwIfCancelled();
        return backupService.pruneOldBackups(keep);
    }
}
