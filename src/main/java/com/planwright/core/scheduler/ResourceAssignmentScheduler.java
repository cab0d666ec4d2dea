package com.planwright.core.scheduler;

import com.planwright.core.metrics.PlanningMetrics;
import com.planwright.core.model.PriorityAssignments;
import com.planwright.core.model.SchedulingWarning;
import com.planwright.core.model.Subtask;
import com.planwright.core.model.Task;
import com.planwright.core.model.TeamMember;
import com.planwright.core.model.WorkItem;
import com.planwright.core.model.WorkerAssignments;
import com.planwright.core.model.WorkerStats;
import com.planwright.core.model.WorkloadSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Assigns tasks and subtasks to team members by skill fit, then evens out the
 * workload.
 * <p>
 * Items are placed greedily in priority order (then sprint, then largest
 * first). A worker is only considered when their remaining hours cover the
 * item, so nobody ends up with negative remaining hours. Subtasks stay with
 * the parent task's assignee when that worker has room. Ties between equally
 * scored workers go to the one listed first in the team.
 */
@Service
public class ResourceAssignmentScheduler {

    private static final Logger log = LoggerFactory.getLogger(ResourceAssignmentScheduler.class);

    private static final int NO_SPRINT = 999;

    private final SchedulerProperties properties;
    private final PlanningMetrics metrics;
    private final Clock clock;

    public ResourceAssignmentScheduler(SchedulerProperties properties, PlanningMetrics metrics, Clock clock) {
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    public WorkerAssignments assign(List<Task> tasks, List<Subtask> subtasks,
                                    PriorityAssignments priorities, List<TeamMember> members) {
        PriorityAssignments effective = priorities != null ? priorities : PriorityAssignments.empty();
        MatchScorer scorer = new MatchScorer(properties);
        WorkloadTracker tracker = new WorkloadTracker(buildLoads(members), scorer, clock);
        List<SchedulingWarning> warnings = new ArrayList<>();
        List<String> unassignedTasks = new ArrayList<>();
        List<String> unassignedSubtasks = new ArrayList<>();

        log.info("Scheduling {} tasks and {} subtasks across {} workers",
                tasks.size(), subtasks.size(), members.size());

        Map<String, Task> tasksById = new LinkedHashMap<>();
        tasks.forEach(t -> tasksById.put(t.id(), t));

        for (Task task : sorted(tasks, effective, tasksById)) {
            Optional<MatchScore> best = bestWorker(task, tracker, scorer);
            if (best.isPresent()) {
                tracker.assign(task, best.get().workerId());
                log.debug("Task {} -> {} (score {})", task.id(), best.get().workerId(),
                        String.format("%.3f", best.get().total()));
            } else {
                unassignedTasks.add(task.id());
                warnings.add(noCapacityWarning(task, "task"));
            }
        }

        for (Subtask subtask : sorted(subtasks, effective, tasksById)) {
            Task parent = tasksById.get(subtask.parentTaskId());
            Optional<String> parentOwner = parent != null ? tracker.ownerOf(parent) : Optional.empty();
            if (parentOwner.isPresent() && tracker.worker(parentOwner.get()).canAbsorb(subtask.estimatedHours())) {
                tracker.assign(subtask, parentOwner.get());
                continue;
            }
            Optional<MatchScore> best = bestWorker(subtask, tracker, scorer);
            if (best.isPresent()) {
                tracker.assign(subtask, best.get().workerId());
            } else {
                unassignedSubtasks.add(subtask.id());
                warnings.add(noCapacityWarning(subtask, "subtask"));
            }
        }

        RebalanceReport report = new WorkloadRebalancer(properties, scorer)
                .rebalance(tracker, tasks, subtasks, effective);

        WorkloadSummary summary = summarize(tracker, warnings, report);
        metrics.recordReassignments(report.reassignments().size());
        if (!unassignedTasks.isEmpty() || !unassignedSubtasks.isEmpty()) {
            metrics.recordUnassigned(unassignedTasks.size() + unassignedSubtasks.size());
            log.warn("{} task(s) and {} subtask(s) could not be assigned",
                    unassignedTasks.size(), unassignedSubtasks.size());
        }

        return new WorkerAssignments(
                namesFor(tracker.taskOwners(), tracker),
                namesFor(tracker.subtaskOwners(), tracker),
                summary,
                unassignedTasks,
                unassignedSubtasks,
                report.reassignments());
    }

    private List<WorkerLoad> buildLoads(List<TeamMember> members) {
        AvailabilityCalculator calculator = new AvailabilityCalculator(
                LocalDate.now(clock), properties.getDefaultWeeklyHours());
        List<WorkerLoad> loads = new ArrayList<>();
        for (TeamMember member : members) {
            WorkerProfile profile = WorkerProfiles.of(member);
            loads.add(new WorkerLoad(profile, calculator.calculate(member.availability())));
        }
        return loads;
    }

    private <T extends WorkItem> List<T> sorted(List<T> items, PriorityAssignments priorities,
                                                Map<String, Task> tasksById) {
        List<T> copy = new ArrayList<>(items);
        copy.sort(Comparator
                .comparingInt((T item) -> priorities.priorityOf(item).rank())
                .thenComparingInt(item -> sprintOf(item, tasksById))
                .thenComparing(Comparator.comparingDouble((T item) -> item.estimatedHours()).reversed()));
        return copy;
    }

    private static int sprintOf(WorkItem item, Map<String, Task> tasksById) {
        Integer sprint = item.sprintNumber();
        if (sprint == null && item instanceof Subtask subtask) {
            Task parent = tasksById.get(subtask.parentTaskId());
            sprint = parent != null ? parent.sprintNumber() : null;
        }
        return sprint != null ? sprint : NO_SPRINT;
    }

    /**
     * Highest-scoring worker with room for the item. Only a strictly higher
     * score displaces an earlier candidate, so ties keep roster order.
     */
    private Optional<MatchScore> bestWorker(WorkItem item, WorkloadTracker tracker, MatchScorer scorer) {
        MatchScore best = null;
        for (WorkerLoad worker : tracker.workers()) {
            if (!worker.canAbsorb(item.estimatedHours())) {
                continue;
            }
            MatchScore score = scorer.score(item, worker);
            if (best == null || score.total() > best.total()) {
                best = score;
            }
        }
        return Optional.ofNullable(best);
    }

    private SchedulingWarning noCapacityWarning(WorkItem item, String type) {
        String message = String.format("No worker has %.1f free hours for %s '%s'",
                item.estimatedHours(), type, item.title());
        log.warn(message);
        return new SchedulingWarning(item.id(), type, message);
    }

    private WorkloadSummary summarize(WorkloadTracker tracker, List<SchedulingWarning> warnings,
                                      RebalanceReport report) {
        List<WorkerStats> stats = new ArrayList<>();
        List<SchedulingWarning> allWarnings = new ArrayList<>(warnings);
        int over = 0;
        int under = 0;
        for (WorkerLoad load : tracker.workers()) {
            int utilization = utilization(load);
            boolean overallocated = utilization > properties.getOverallocatedPercent();
            boolean underallocated = utilization < properties.getUnderallocatedPercent();
            if (overallocated) {
                over++;
                allWarnings.add(new SchedulingWarning(load.id(), "team",
                        load.profile().name() + " is allocated at " + utilization + "% of available hours"));
            } else if (underallocated) {
                under++;
            }
            stats.add(new WorkerStats(load.id(), load.profile().name(), load.profile().role(),
                    load.assignedHours(), load.totalAvailableHours(), load.remainingHours(), utilization,
                    load.taskIds().size(), load.subtaskIds().size(), overallocated, underallocated));
        }
        return new WorkloadSummary(stats, over, under, allWarnings, report.initial(), report.result());
    }

    private static int utilization(WorkerLoad load) {
        if (load.totalAvailableHours() <= 0) {
            return load.assignedHours() > 0 ? 100 : 0;
        }
        return (int) Math.min(100, Math.round(load.assignedHours() / load.totalAvailableHours() * 100));
    }

    private static Map<String, String> namesFor(Map<String, String> owners, WorkloadTracker tracker) {
        Map<String, String> names = new LinkedHashMap<>();
        Map<String, String> cache = new HashMap<>();
        owners.forEach((itemId, workerId) -> names.put(itemId,
                cache.computeIfAbsent(workerId, id -> tracker.worker(id).profile().name())));
        return names;
    }
}
