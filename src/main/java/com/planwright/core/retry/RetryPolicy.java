package com.planwright.core.retry;

import java.time.Duration;
import java.util.Set;

/**
 * Exponential backoff parameters.
 *
 * @param maxRetries     retries after the first attempt; 0 disables retrying
 * @param initialDelay   delay before the first retry
 * @param backoffFactor  multiplier applied per further retry
 * @param maxDelay       upper bound for any single delay
 * @param retryableCodes error codes treated as transient
 */
public record RetryPolicy(
    int maxRetries,
    Duration initialDelay,
    double backoffFactor,
    Duration maxDelay,
    Set<String> retryableCodes
) {

    public static final Set<String> DEFAULT_RETRYABLE_CODES = Set.of(
            "ECONNRESET", "ETIMEDOUT", "ECONNREFUSED", "NETWORK_ERROR",
            "RATE_LIMIT", "SERVER_ERROR", "TIMEOUT");

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be >= 1.0");
        }
        initialDelay = initialDelay == null ? Duration.ZERO : initialDelay;
        maxDelay = maxDelay == null ? initialDelay : maxDelay;
        retryableCodes = retryableCodes == null ? DEFAULT_RETRYABLE_CODES : Set.copyOf(retryableCodes);
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(1000), 1.5, Duration.ofMillis(30_000), DEFAULT_RETRYABLE_CODES);
    }

    /**
     * Delay before retry number {@code attempt} (1-based):
     * {@code min(initialDelay * backoffFactor^(attempt-1), maxDelay)}.
     */
    public Duration delayForAttempt(int attempt) {
        double millis = initialDelay.toMillis() * Math.pow(backoffFactor, Math.max(0, attempt - 1));
        long bounded = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Duration.ofMillis(bounded);
    }

    public RetryPolicy withMaxRetries(int retries) {
        return new RetryPolicy(retries, initialDelay, backoffFactor, maxDelay, retryableCodes);
    }
}
