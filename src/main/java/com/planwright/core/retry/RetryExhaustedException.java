package com.planwright.core.retry;

/**
 * Thrown when an operation fails with a fatal error or keeps failing after all retries.
 * The original failure is the cause.
 */
public class RetryExhaustedException extends RuntimeException {

    private final int retriesAttempted;
    private final String retryContext;
    private final boolean retryable;

    public RetryExhaustedException(String retryContext, int retriesAttempted, boolean retryable, Throwable cause) {
        super(buildMessage(retryContext, retriesAttempted, retryable, cause), cause);
        this.retriesAttempted = retriesAttempted;
        this.retryContext = retryContext;
        this.retryable = retryable;
    }

    public int getRetriesAttempted() {
        return retriesAttempted;
    }

    public String getRetryContext() {
        return retryContext;
    }

    /**
     * Whether the last failure was classified transient (true when retries ran out,
     * false when a fatal error stopped the loop).
     */
    public boolean isRetryable() {
        return retryable;
    }

    private static String buildMessage(String context, int retries, boolean retryable, Throwable cause) {
        String reason = cause == null ? "unknown error" : cause.getMessage();
        if (!retryable) {
            return context + " failed with non-retryable error: " + reason;
        }
        return context + " failed after " + retries + " retries: " + reason;
    }
}
