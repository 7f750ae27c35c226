package com.strata.scheduler;

import com.strata.history.OperationResult;

/**
 * A unit of periodic lifecycle work run by the {@link LifecycleScheduler}.
 *
 * Implementations check {@link JobContext#isCancelled()} between bounded units
 * of work and report failures by throwing a
 * {@link com.strata.error.LifecycleException}.
 */
public interface LifecycleJob {

    JobType type();

    OperationResult run(JobContext context);
}
