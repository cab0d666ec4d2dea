package com.planwright.core.retry;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RetryConfig {

    @Bean
    public ErrorClassifier errorClassifier() {
        return new ErrorClassifier();
    }

    @Bean
    public RetryExecutor retryExecutor(RetryProperties properties, ErrorClassifier errorClassifier) {
        return new RetryExecutor(properties.toPolicy(), errorClassifier, Sleeper.THREAD);
    }
}
