package com.planwright.core.model;

import java.io.Serializable;
import java.util.Collection;

/**
 * Distribution of assigned hours across workers.
 */
public record BalanceStats(
    double mean,
    double standardDeviation,
    double min,
    double max
) implements Serializable {

    public static BalanceStats of(Collection<Double> hours) {
        if (hours == null || hours.isEmpty()) {
            return new BalanceStats(0, 0, 0, 0);
        }
        double sum = 0;
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (double h : hours) {
            sum += h;
            min = Math.min(min, h);
            max = Math.max(max, h);
        }
        double mean = sum / hours.size();
        double variance = 0;
        for (double h : hours) {
            variance += (h - mean) * (h - mean);
        }
        variance /= hours.size();
        return new BalanceStats(mean, Math.sqrt(variance), min, max);
    }
}
