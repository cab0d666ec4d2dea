package com.planwright.core.scheduler;

import com.planwright.core.model.BalanceStats;
import com.planwright.core.model.Reassignment;

import java.util.List;

/**
 * Outcome of one rebalancing pass.
 *
 * @param triggered     whether the imbalance threshold was crossed
 * @param initial       distribution of assigned hours before the pass
 * @param result        distribution after the pass
 * @param reassignments moves made, in order
 */
public record RebalanceReport(
    boolean triggered,
    BalanceStats initial,
    BalanceStats result,
    List<Reassignment> reassignments
) {

    public RebalanceReport {
        reassignments = reassignments == null ? List.of() : List.copyOf(reassignments);
    }

    public double hoursMoved() {
        return reassignments.stream().mapToDouble(Reassignment::hours).sum();
    }
}
