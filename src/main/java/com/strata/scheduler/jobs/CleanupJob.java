package com.strata.scheduler.jobs;

import com.strata.history.OperationResult;
import com.strata.scheduler.JobContext;
import com.strata.scheduler.JobType;
import com.strata.scheduler.LifecycleJob;
import com.strata.transition.TierTransitionEngine;
import org.springframework.stereotype.Component;

/**
 * Downsamples and deletes data according to the enabled retention policies.
 */
@Component
public class CleanupJob implements LifecycleJob {

    private final TierTransitionEngine engine;

    public CleanupJob(TierTransitionEngine engine) {
        this.engine = engine;
    }

    @Override
    public JobType type() {
        return JobType.CLEANUP;
    }

    @Override
    public OperationResult run(JobContext context) {
        return engine.run(context);
    }
}
