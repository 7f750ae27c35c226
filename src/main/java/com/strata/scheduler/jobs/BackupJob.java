package com.strata.scheduler.jobs;

import com.strata.backup.BackupService;
import com.strata.history.OperationResult;
import com.strata.scheduler.JobContext;
import com.strata.scheduler.JobType;
import com.strata.scheduler.LifecycleJob;
import org.springframework.stereotype.Component;

@Component
public class BackupJob implements LifecycleJob {

    private final BackupService backupService;

    public BackupJob(BackupService backupService) {
        this.backupService = backupService;
    }

    @Override
    public JobType type() {
        return JobType.BACKUP;
    }

    @Override
    public OperationResult run(JobContext context) {
        return backupService.createBackup(context);
    }
}
