package com.strata.error;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Builds operator-facing error summaries.
 *
 * Only the category and the exception's safe message are used. Messages of
 * foreign exceptions are never copied, since they routinely carry file paths,
 * JDBC URLs or credentials.
 */
public final class ErrorSummaries {

    private ErrorSummaries() {
    }

    public static String summarize(Throwable error) {
        Throwable root = unwrap(error);
        if (root instanceof LifecycleException) {
            LifecycleException le = (LifecycleException) root;
            return le.getCategory().name() + ": " + le.getSafeMessage();
        }
        if (root instanceof InterruptedException) {
            return ErrorCategory.TIMEOUT.name() + ": operation interrupted";
        }
        if (root instanceof CancellationException) {
            return ErrorCategory.TIMEOUT.name() + ": operation cancelled";
        }
        return ErrorCategory.INTERNAL.name() + ": unexpected failure";
    }

    public static ErrorCategory categorize(Throwable error) {
        Throwable root = unwrap(error);
        if (root instanceof LifecycleException) {
            return ((LifecycleException) root).getCategory();
        }
        if (root instanceof CancellationException) {
            return ErrorCategory.TIMEOUT;
        }
        return ErrorCategory.INTERNAL;
    }

    /**
     * Strips executor wrapper exceptions so the real failure is visible.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
