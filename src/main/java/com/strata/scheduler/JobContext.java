package com.strata.scheduler;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation handle passed to a running job.
 *
 * Long-running jobs check it between bounded units of work (chunks, batches).
 * The scheduler cancels it on timeout and also interrupts the worker thread.
 */
public class JobContext {

    private final JobType jobType;
    private final int attempt;
    private volatile boolean cancelled;

    public JobContext(JobType jobType, int attempt) {
        this.jobType = jobType;
        this.attempt = attempt;
    }

    /**
     * Context for direct calls outside the scheduler (tests, manual runs).
     */
    public static JobContext detached(JobType jobType) {
        return new JobContext(jobType, 1);
    }

    public JobType getJobType() {
        return jobType;
    }

    public int getAttempt() {
        return attempt;
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || Thread.currentThread().isInterrupted();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException(jobType + " cancelled");
        }
    }
}
