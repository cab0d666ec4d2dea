package com.planwright.core.retry;

import com.planwright.core.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Runs an operation, retrying transient failures with exponential backoff.
 * <p>
 * The executor holds no per-call state, so one instance serves every run.
 * Delays block only the calling thread.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryPolicy defaultPolicy;
    private final ErrorClassifier classifier;
    private final Sleeper sleeper;

    public RetryExecutor(RetryPolicy defaultPolicy, ErrorClassifier classifier, Sleeper sleeper) {
        this.defaultPolicy = defaultPolicy;
        this.classifier = classifier;
        this.sleeper = sleeper;
    }

    public RetryPolicy getDefaultPolicy() {
        return defaultPolicy;
    }

    public <T> T executeWithRetry(Callable<T> operation, String context) {
        return executeWithRetry(operation, context, defaultPolicy);
    }

    /**
     * Invokes {@code operation} until it succeeds, fails fatally, or {@code policy.maxRetries()}
     * retries have been spent.
     *
     * @param context label used in logs and in the thrown exception, e.g. "proj_ab12:taskGeneration"
     * @param policy  backoff to apply; {@code null} means the default policy
     * @throws RetryExhaustedException wrapping the last failure
     */
    public <T> T executeWithRetry(Callable<T> operation, String context, RetryPolicy policy) {
        RetryPolicy effective = policy != null ? policy : defaultPolicy;
        int attempt = 0;
        while (true) {
            attempt++;
            MdcContext.setAttempt(attempt);
            try {
                return operation.call();
            } catch (Exception e) {
                ErrorClassifier.Classification classification =
                        classifier.classify(e, effective.retryableCodes());
                int retriesSoFar = attempt - 1;
                if (!classification.retryable()) {
                    log.error("{} failed with non-retryable error ({}): {}",
                            context, classification.reason(), e.getMessage());
                    throw new RetryExhaustedException(context, retriesSoFar, false, e);
                }
                if (retriesSoFar >= effective.maxRetries()) {
                    log.error("{} failed after {} retries: {}", context, retriesSoFar, e.getMessage());
                    throw new RetryExhaustedException(context, retriesSoFar, true, e);
                }
                Duration delay = effective.delayForAttempt(attempt);
                log.warn("Retry attempt {}/{} for {} after {}ms delay: {}",
                        attempt, effective.maxRetries(), context, delay.toMillis(), e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    RetryExhaustedException aborted = new RetryExhaustedException(context, retriesSoFar, true, e);
                    aborted.addSuppressed(ie);
                    throw aborted;
                }
            }
        }
    }
}
