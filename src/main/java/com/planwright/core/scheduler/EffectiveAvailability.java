package com.planwright.core.scheduler;

/**
 * Weekly hours a member can give the project as of the planning date.
 *
 * @param hoursPerWeek          never negative
 * @param allocationPercentage  share of base hours allocated to this project, 100 when unchanged
 * @param historicalPerformance rated history, or {@code null} when the member has none
 */
public record EffectiveAvailability(
    double hoursPerWeek,
    double allocationPercentage,
    HistoricalPerformance historicalPerformance
) {}
