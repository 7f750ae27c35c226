package com.strata.error;

/**
 * Base exception for the lifecycle engine.
 *
 * Carries a category and a safe message. The safe message is what ends up in
 * operation history; the regular exception message may contain internal detail
 * (paths, SQL) and is only ever logged.
 */
public class LifecycleException extends RuntimeException {

    private final ErrorCategory category;
    private final String safeMessage;

    public LifecycleException(ErrorCategory category, String safeMessage) {
        super(safeMessage);
        this.category = category;
        this.safeMessage = safeMessage;
    }

    public LifecycleException(ErrorCategory category, String safeMessage, String detail) {
        super(detail);
        this.category = category;
        this.safeMessage = safeMessage;
    }

    public LifecycleException(ErrorCategory category, String safeMessage, Throwable cause) {
        super(safeMessage, cause);
        this.category = category;
        this.safeMessage = safeMessage;
    }

    public LifecycleException(ErrorCategory category, String safeMessage, String detail, Throwable cause) {
        super(detail, cause);
        this.category = category;
        this.safeMessage = safeMessage;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public String getSafeMessage() {
        return safeMessage;
    }
}
