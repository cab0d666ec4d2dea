package com.planwright.core.model;

import java.io.Serializable;

/**
 * Per-worker line of the workload summary.
 */
public record WorkerStats(
    String workerId,
    String name,
    String role,
    double assignedHours,
    double availableHours,
    double remainingHours,
    int utilizationPercentage,
    int assignedTaskCount,
    int assignedSubtaskCount,
    boolean overallocated,
    boolean underallocated
) implements Serializable {}
