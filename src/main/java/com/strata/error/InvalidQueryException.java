package com.strata.error;

/**
 * Unknown view name or filter key passed to the materialized view manager.
 */
public class InvalidQueryException extends LifecycleException {

    public InvalidQueryException(String safeMessage) {
        super(ErrorCategory.INVALID_QUERY, safeMessage);
    }
}
