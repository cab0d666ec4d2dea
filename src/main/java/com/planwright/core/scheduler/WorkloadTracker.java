package com.planwright.core.scheduler;

import com.planwright.core.model.BalanceStats;
import com.planwright.core.model.Subtask;
import com.planwright.core.model.WorkItem;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-run ledger of who holds which item and how many hours each worker has left.
 * Workers are kept in roster order.
 */
public class WorkloadTracker {

    private final Map<String, WorkerLoad> loads = new LinkedHashMap<>();
    private final Map<String, String> taskOwners = new LinkedHashMap<>();
    private final Map<String, String> subtaskOwners = new LinkedHashMap<>();
    private final MatchScorer scorer;
    private final Clock clock;

    public WorkloadTracker(List<WorkerLoad> workers, MatchScorer scorer, Clock clock) {
        for (WorkerLoad load : workers) {
            loads.put(load.id(), load);
        }
        this.scorer = scorer;
        this.clock = clock;
    }

    public List<WorkerLoad> workers() {
        return List.copyOf(loads.values());
    }

    public WorkerLoad worker(String workerId) {
        WorkerLoad load = loads.get(workerId);
        if (load == null) {
            throw new IllegalArgumentException("Unknown worker: " + workerId);
        }
        return load;
    }

    public Optional<String> ownerOf(WorkItem item) {
        return Optional.ofNullable(owners(item).get(item.id()));
    }

    public Map<String, String> taskOwners() {
        return Collections.unmodifiableMap(taskOwners);
    }

    public Map<String, String> subtaskOwners() {
        return Collections.unmodifiableMap(subtaskOwners);
    }

    /** Initial placement; only later moves are written to the work history. */
    public void assign(WorkItem item, String workerId) {
        WorkerLoad load = worker(workerId);
        load.add(item.id(), isSubtask(item), item.estimatedHours());
        owners(item).put(item.id(), workerId);
    }

    /**
     * Moves an item between workers. The source worker's history records the
     * hand-off and the target's records the new assignment.
     */
    public void transfer(WorkItem item, String fromWorkerId, String toWorkerId) {
        WorkerLoad from = worker(fromWorkerId);
        WorkerLoad to = worker(toWorkerId);
        boolean subtask = isSubtask(item);
        from.remove(item.id(), subtask, item.estimatedHours());
        from.record(historyEntry(item, "reassigned"));
        to.add(item.id(), subtask, item.estimatedHours());
        to.record(historyEntry(item, "assigned"));
        owners(item).put(item.id(), toWorkerId);
    }

    public BalanceStats balance() {
        List<Double> hours = new ArrayList<>();
        for (WorkerLoad load : loads.values()) {
            hours.add(load.assignedHours());
        }
        return BalanceStats.of(hours);
    }

    private Map<String, String> owners(WorkItem item) {
        return isSubtask(item) ? subtaskOwners : taskOwners;
    }

    private static boolean isSubtask(WorkItem item) {
        return item instanceof Subtask;
    }

    private WorkHistoryEntry historyEntry(WorkItem item, String action) {
        return new WorkHistoryEntry(item.id(), item.title(), action, item.estimatedHours(),
                scorer.extractTaskSkills(item), clock.instant());
    }
}
