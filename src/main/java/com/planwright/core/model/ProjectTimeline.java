package com.planwright.core.model;

import java.io.Serializable;

/**
 * Parsed project duration.
 *
 * @param original       the text the timeline was parsed from, e.g. "3 months"
 * @param amount         the numeric part
 * @param unit           singular unit: day, week, month or year
 * @param durationInDays length in days (months count 30 days, years 365)
 */
public record ProjectTimeline(
    String original,
    int amount,
    String unit,
    int durationInDays
) implements Serializable {

    public int weeks() {
        return Math.max(1, (int) Math.ceil(durationInDays / 7.0));
    }
}
