package com.strata.error;

/**
 * Categories surfaced in operation history and alerts.
 * The category name is part of every error summary shown to operators.
 */
public enum ErrorCategory {
    INVALID_POLICY(false),
    NOT_FOUND(false),
    TRANSIENT_STORE_ERROR(true),
    INTEGRITY_VIOLATION(false),
    RESOURCE_BUSY(false),
    INVALID_QUERY(false),
    TIMEOUT(true),
    INTERNAL(false);

    private final boolean retryable;

    ErrorCategory(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Whether the scheduler may retry an operation failing with this category
     * within the same cycle.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
