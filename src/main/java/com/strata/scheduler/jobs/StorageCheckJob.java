package com.strata.scheduler.jobs;

import com.strata.history.OperationResult;
import com.strata.monitor.StorageMonitor;
import com.strata.scheduler.JobContext;
import com.strata.scheduler.JobType;
import com.strata.scheduler.LifecycleJob;
import org.springframework.stereotype.Component;

@Component
public class StorageCheckJob implements LifecycleJob {

    private final StorageMonitor monitor;

    public StorageCheckJob(StorageMonitor monitor) {
        this.monitor = monitor;
    }

    @Override
    public JobType type() {
        return JobType.STORAGE_CHECK;
    }

    @Override
    public OperationResult run(JobContext context) {
        return monitor.run(context);
    }
}
