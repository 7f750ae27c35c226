package com.strata.history;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.strata.error.ErrorSummaries;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one lifecycle operation.
 * Component-specific results extend this with their own counters.
 */
public class OperationResult {

    @JsonProperty("operation")
    private final String operation;

    @JsonProperty("started_at")
    private final Instant startedAt;

    @JsonProperty("duration")
    private Duration duration = Duration.ZERO;

    @JsonProperty("success")
    private boolean success;

    @JsonProperty("items_processed")
    private long itemsProcessed;

    @JsonProperty("error_summary")
    private String errorSummary;

    public OperationResult(String operation, Instant startedAt) {
        this.operation = operation;
        this.startedAt = startedAt;
    }

    /**
     * Mark the operation successful and stamp its duration.
     */
    public void succeed(Instant finishedAt) {
        this.success = true;
        this.errorSummary = null;
        this.duration = Duration.between(startedAt, finishedAt);
    }

    /**
     * Mark the operation failed; only the safe summary of the error is kept.
     */
    public void fail(Instant finishedAt, Throwable error) {
        this.success = false;
        this.errorSummary = ErrorSummaries.summarize(error);
        this.duration = Duration.between(startedAt, finishedAt);
    }

    public void fail(Instant finishedAt, String errorSummary) {
        this.success = false;
        this.errorSummary = errorSummary;
        this.duration = Duration.between(startedAt, finishedAt);
    }

    public String getOperation() {
        return operation;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Duration getDuration() {
        return duration;
    }

    public boolean isSuccess() {
        return success;
    }

    public long getItemsProcessed() {
        return itemsProcessed;
    }

    public void setItemsProcessed(long itemsProcessed) {
        this.itemsProcessed = itemsProcessed;
    }

    public void addItemsProcessed(long count) {
        this.itemsProcessed += count;
    }

    public String getErrorSummary() {
        return errorSummary;
    }

    @Override
    public String toString() {
        return operation + "[success=" + success + ", items=" + itemsProcessed
            + ", duration=" + duration.toMillis() + "ms"
            + (errorSummary != null ? ", error=" + errorSummary : "") + "]";
    }
}
