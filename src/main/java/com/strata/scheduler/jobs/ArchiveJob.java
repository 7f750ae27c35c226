package com.strata.scheduler.jobs;

import com.strata.history.OperationResult;
import com.strata.scheduler.JobContext;
import com.strata.scheduler.JobType;
import com.strata.scheduler.LifecycleJob;
import com.strata.storage.cold.ArchivalService;
import org.springframework.stereotype.Component;

/**
 * Moves data past its archive cutoff into the cold tier.
 */
@Component
public class ArchiveJob implements LifecycleJob {

    private final ArchivalService archivalService;

    public ArchiveJob(ArchivalService archivalService) {
        this.archivalService = archivalService;
    }

    @Override
    public JobType type() {
        return JobType.ARCHIVE;
    }

    @Override
    public OperationResult run(JobContext context) {
        return archivalService.run(context);
    }
}
