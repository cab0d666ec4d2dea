package com.planwright.core.scheduler;

/**
 * Weighted fit of one worker for one item, with the parts it was built from.
 */
public record MatchScore(
    String workerId,
    double total,
    double skill,
    double role,
    double availability,
    double workload,
    double history,
    double specialty
) {}
