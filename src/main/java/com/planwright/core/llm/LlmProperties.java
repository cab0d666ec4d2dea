package com.planwright.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "planwright.llm")
public class LlmProperties {

    private double temperature = 0.7;
    private int maxOutputTokens = 4000;
    private Duration timeout = Duration.ofMinutes(3);

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public int getMaxOutputTokens() {
        return maxOutputTokens;
    }

    public void setMaxOutputTokens(int maxOutputTokens) {
        this.maxOutputTokens = maxOutputTokens;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public GenerationOptions defaultOptions() {
        return new GenerationOptions(temperature, maxOutputTokens, timeout);
    }
}
