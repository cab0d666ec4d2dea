package com.planwright.core.retry;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

@Component
@ConfigurationProperties(prefix = "planwright.retry")
public class RetryProperties {

    private int maxRetries = 3;
    private Duration initialDelay = Duration.ofMillis(1000);
    private double backoffFactor = 1.5;
    private Duration maxDelay = Duration.ofMillis(30_000);
    private Set<String> retryableCodes = new LinkedHashSet<>(RetryPolicy.DEFAULT_RETRYABLE_CODES);

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
        this.initialDelay = initialDelay;
    }

    public double getBackoffFactor() {
        return backoffFactor;
    }

    public void setBackoffFactor(double backoffFactor) {
        this.backoffFactor = backoffFactor;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
        this.maxDelay = maxDelay;
    }

    public Set<String> getRetryableCodes() {
        return retryableCodes;
    }

    public void setRetryableCodes(Set<String> retryableCodes) {
        this.retryableCodes = retryableCodes;
    }

    public RetryPolicy toPolicy() {
        return new RetryPolicy(maxRetries, initialDelay, backoffFactor, maxDelay, retryableCodes);
    }
}
