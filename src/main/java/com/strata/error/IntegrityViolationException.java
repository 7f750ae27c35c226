package com.strata.error;

/**
 * Archive path escape, checksum mismatch or a corrupt backup. Always fatal,
 * never retried.
 */
public class IntegrityViolationException extends LifecycleException {

    public IntegrityViolationException(String safeMessage) {
        super(ErrorCategory.INTEGRITY_VIOLATION, safeMessage);
    }

    public IntegrityViolationException(String safeMessage, String detail) {
        super(ErrorCategory.INTEGRITY_VIOLATION, safeMessage, detail);
    }

    public IntegrityViolationException(String safeMessage, Throwable cause) {
        super(ErrorCategory.INTEGRITY_VIOLATION, safeMessage, cause);
    }
}
