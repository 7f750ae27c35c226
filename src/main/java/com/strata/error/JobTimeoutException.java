package com.strata.error;

import java.time.Duration;

/**
 * A scheduled job exceeded its configured timeout and was cancelled.
 */
public class JobTimeoutException extends LifecycleException {

    public JobTimeoutException(String jobType, Duration timeout) {
        super(ErrorCategory.TIMEOUT, jobType + " timed out after " + timeout.toSeconds() + "s");
    }
}
