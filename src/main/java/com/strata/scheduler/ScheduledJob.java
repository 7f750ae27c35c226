package com.strata.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.strata.history.OperationResult;

import java.time.Duration;
import java.time.Instant;

/**
 * Scheduling state of one periodic job type. Mutated only by the scheduler;
 * everyone else sees {@link #snapshot()} copies.
 */
public class ScheduledJob {

    @JsonProperty("job_type")
    private final JobType jobType;

    @JsonProperty("interval")
    private final Duration interval;

    @JsonProperty("next_due_at")
    private Instant nextDueAt;

    @JsonProperty("last_run_at")
    private Instant lastRunAt;

    @JsonProperty("state")
    private JobState state = JobState.IDLE;

    @JsonProperty("last_result")
    private OperationResult lastResult;

    @JsonProperty("consecutive_failures")
    private int consecutiveFailures;

    public ScheduledJob(JobType jobType, Duration interval, Instant lastRunAt, Instant now) {
        this.jobType = jobType;
        this.interval = interval;
        this.lastRunAt = lastRunAt;
        this.nextDueAt = lastRunAt != null ? lastRunAt.plus(interval) : now;
    }

    private ScheduledJob(ScheduledJob other) {
        this.jobType = other.jobType;
        this.interval = other.interval;
        this.nextDueAt = other.nextDueAt;
        this.lastRunAt = other.lastRunAt;
        this.state = other.state;
        this.lastResult = other.lastResult;
        this.consecutiveFailures = other.consecutiveFailures;
    }

    public ScheduledJob snapshot() {
        return new ScheduledJob(this);
    }

    /**
     * Eligible for dispatch: not already queued or running, and due.
     */
    boolean isDue(Instant now) {
        return state != JobState.DUE && state != JobState.RUNNING && !nextDueAt.isAfter(now);
    }

    void completed(Instant startedAt, OperationResult result) {
        lastRunAt = startedAt;
        nextDueAt = startedAt.plus(interval);
        lastResult = result;
        if (result.isSuccess()) {
            consecutiveFailures = 0;
            state = JobState.SUCCEEDED;
        } else {
            consecutiveFailures++;
            state = JobState.FAILED;
        }
    }

    void postpone(Instant until, OperationResult result) {
        nextDueAt = until;
        lastResult = result;
        state = JobState.IDLE;
    }

    public JobType getJobType() {
        return jobType;
    }

    public Duration getInterval() {
        return interval;
    }

    public Instant getNextDueAt() {
        return nextDueAt;
    }

    void setNextDueAt(Instant nextDueAt) {
        this.nextDueAt = nextDueAt;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public JobState getState() {
        return state;
    }

    void setState(JobState state) {
        this.state = state;
    }

    public OperationResult getLastResult() {
        return lastResult;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    @Override
    public String toString() {
        return "ScheduledJob{" + jobType + ", state=" + state + ", next=" + nextDueAt
            + ", failures=" + consecutiveFailures + "}";
    }
}
