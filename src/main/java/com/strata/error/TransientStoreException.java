package com.strata.error;

/**
 * Retryable failure talking to the time-series store or object storage.
 */
public class TransientStoreException extends LifecycleException {

    public TransientStoreException(String safeMessage, Throwable cause) {
        super(ErrorCategory.TRANSIENT_STORE_ERROR, safeMessage, cause);
    }

    public TransientStoreException(String safeMessage) {
        super(ErrorCategory.TRANSIENT_STORE_ERROR, safeMessage);
    }
}
