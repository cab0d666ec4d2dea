package com.planwright.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Team-level result of scheduling.
 */
public record WorkloadSummary(
    List<WorkerStats> workers,
    int overallocatedWorkers,
    int underallocatedWorkers,
    List<SchedulingWarning> warnings,
    BalanceStats initialBalance,
    BalanceStats finalBalance
) implements Serializable {

    public WorkloadSummary {
        workers = workers == null ? List.of() : List.copyOf(workers);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
