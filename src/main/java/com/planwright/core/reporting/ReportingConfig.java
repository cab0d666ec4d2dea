package com.planwright.core.reporting;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ReportingConfig {

    @Bean
    public ErrorReporter errorReporter(ReportingProperties properties, Clock clock) {
        return new ErrorReporter(properties, clock);
    }
}
