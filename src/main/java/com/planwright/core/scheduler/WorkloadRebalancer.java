package com.planwright.core.scheduler;

import com.planwright.core.model.BalanceStats;
import com.planwright.core.model.Priority;
import com.planwright.core.model.PriorityAssignments;
import com.planwright.core.model.Reassignment;
import com.planwright.core.model.Subtask;
import com.planwright.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Moves work from overloaded to underloaded workers once the spread of
 * assigned hours grows too wide.
 * <p>
 * Only non-critical tasks move. A task takes along its subtasks that sit with
 * the same worker, and the target must be able to absorb all of it. When task
 * moves recover less than the configured fraction of the target, individual
 * subtasks are moved as well, up to the same target. A move is only made when
 * the hours moved are smaller than the gap between source and target, so each
 * move strictly lowers the standard deviation. Every loop walks a snapshot
 * taken before it starts, so the pass always terminates.
 */
public class WorkloadRebalancer {

    private static final Logger log = LoggerFactory.getLogger(WorkloadRebalancer.class);

    private static final List<String> CRITICAL_KEYWORDS =
            List.of("critical", "urgent", "essential", "core", "key", "foundation");

    private final SchedulerProperties properties;
    private final MatchScorer scorer;

    public WorkloadRebalancer(SchedulerProperties properties, MatchScorer scorer) {
        this.properties = properties;
        this.scorer = scorer;
    }

    public RebalanceReport rebalance(WorkloadTracker tracker, List<Task> tasks, List<Subtask> subtasks,
                                     PriorityAssignments priorities) {
        BalanceStats initial = tracker.balance();
        if (initial.mean() <= 0 || initial.standardDeviation() <= properties.getImbalanceThreshold() * initial.mean()) {
            log.debug("Workload balanced (mean={}, stdDev={}), no rebalancing needed",
                    initial.mean(), initial.standardDeviation());
            return new RebalanceReport(false, initial, initial, List.of());
        }
        log.info("Workload imbalance detected (mean={}, stdDev={}), rebalancing",
                String.format("%.1f", initial.mean()), String.format("%.1f", initial.standardDeviation()));

        double mean = initial.mean();
        List<WorkerLoad> overloaded = tracker.workers().stream()
                .filter(w -> w.assignedHours() > mean * properties.getOverloadFactor() * w.allocationPercentage() / 100)
                .sorted(Comparator.comparingDouble((WorkerLoad w) -> overloadAmount(w, mean)).reversed())
                .toList();
        List<WorkerLoad> underloaded = tracker.workers().stream()
                .filter(w -> w.assignedHours() < mean * properties.getUnderloadFactor() * w.allocationPercentage() / 100)
                .filter(w -> w.remainingHours() > 0)
                .sorted(Comparator.comparingDouble(WorkerLoad::remainingHours).reversed())
                .toList();

        if (overloaded.isEmpty() || underloaded.isEmpty()) {
            log.info("Cannot rebalance: {} overloaded and {} underloaded workers",
                    overloaded.size(), underloaded.size());
            return new RebalanceReport(true, initial, initial, List.of());
        }

        Map<String, Task> tasksById = new LinkedHashMap<>();
        tasks.forEach(t -> tasksById.put(t.id(), t));
        List<Reassignment> moves = new ArrayList<>();

        for (WorkerLoad source : overloaded) {
            double target = overloadAmount(source, mean) * properties.getReallocationTarget();
            double moved = moveTasks(tracker, source, underloaded, tasksById, subtasks, priorities, target, moves);
            if (moved < target * properties.getSubtaskFallbackFraction()) {
                moveSubtasks(tracker, source, underloaded, subtasks, target - moved, moves);
            }
        }

        BalanceStats result = tracker.balance();
        log.info("Rebalancing moved {} item(s); stdDev {} -> {}", moves.size(),
                String.format("%.2f", initial.standardDeviation()), String.format("%.2f", result.standardDeviation()));
        return new RebalanceReport(true, initial, result, moves);
    }

    /**
     * A task stays put when its priority is Critical or High, or when its
     * title or description carries a critical keyword.
     */
    public static boolean isTaskCritical(Task task, PriorityAssignments priorities) {
        Priority priority = priorities.priorityOf(task);
        if (priority == Priority.CRITICAL || priority == Priority.HIGH) {
            return true;
        }
        String text = task.searchText();
        return CRITICAL_KEYWORDS.stream().anyMatch(text::contains);
    }

    private double moveTasks(WorkloadTracker tracker, WorkerLoad source, List<WorkerLoad> underloaded,
                             Map<String, Task> tasksById, List<Subtask> subtasks,
                             PriorityAssignments priorities, double target, List<Reassignment> moves) {
        List<Task> candidates = source.taskIds().stream()
                .map(tasksById::get)
                .filter(t -> t != null && !isTaskCritical(t, priorities))
                .sorted(Comparator.comparingLong((Task t) -> subtaskCount(t, subtasks))
                        .thenComparingDouble(Task::estimatedHours))
                .toList();

        double moved = 0;
        for (Task task : candidates) {
            if (moved >= target) {
                break;
            }
            List<Subtask> cascade = subtasks.stream()
                    .filter(s -> task.id().equals(s.parentTaskId()))
                    .filter(s -> tracker.ownerOf(s).map(source.id()::equals).orElse(false))
                    .toList();
            double hours = task.estimatedHours() + cascade.stream().mapToDouble(Subtask::estimatedHours).sum();

            WorkerLoad best = null;
            double bestScore = 0;
            for (WorkerLoad candidate : underloaded) {
                if (!candidate.canAbsorb(hours) || !narrowsGap(source, candidate, hours)) {
                    continue;
                }
                double score = scorer.rebalanceScore(task, candidate);
                if (score > bestScore) {
                    bestScore = score;
                    best = candidate;
                }
            }
            if (best == null || bestScore <= properties.getMinMatchScore()) {
                continue;
            }

            tracker.transfer(task, source.id(), best.id());
            List<String> cascaded = new ArrayList<>();
            for (Subtask subtask : cascade) {
                tracker.transfer(subtask, source.id(), best.id());
                cascaded.add(subtask.id());
            }
            moved += hours;
            moves.add(new Reassignment(task.id(), "task", source.id(), best.id(), hours, bestScore, cascaded));
            log.info("Reassigned task {} ({} h incl. {} subtask(s)) from {} to {} (score {})",
                    task.id(), hours, cascaded.size(), source.id(), best.id(), String.format("%.2f", bestScore));
        }
        return moved;
    }

    private void moveSubtasks(WorkloadTracker tracker, WorkerLoad source, List<WorkerLoad> underloaded,
                              List<Subtask> subtasks, double target, List<Reassignment> moves) {
        List<Subtask> held = subtasks.stream()
                .filter(s -> tracker.ownerOf(s).map(source.id()::equals).orElse(false))
                .sorted(Comparator.comparingDouble(Subtask::estimatedHours))
                .toList();

        double moved = 0;
        for (Subtask subtask : held) {
            if (moved >= target) {
                break;
            }
            if (subtask.estimatedHours() < properties.getMinSubtaskHoursToMove()) {
                continue;
            }
            List<String> skills = scorer.extractTaskSkills(subtask);
            WorkerLoad best = null;
            double bestScore = 0;
            for (WorkerLoad candidate : underloaded) {
                if (!candidate.canAbsorb(subtask.estimatedHours())
                        || !narrowsGap(source, candidate, subtask.estimatedHours())) {
                    continue;
                }
                double score = scorer.skillMatch(skills, candidate.profile());
                if (score > bestScore) {
                    bestScore = score;
                    best = candidate;
                }
            }
            if (best != null && bestScore > properties.getMinMatchScore()) {
                tracker.transfer(subtask, source.id(), best.id());
                moved += subtask.estimatedHours();
                moves.add(new Reassignment(subtask.id(), "subtask", source.id(), best.id(),
                        subtask.estimatedHours(), bestScore, List.of()));
                log.info("Reassigned subtask {} from {} to {}", subtask.id(), source.id(), best.id());
            }
        }
    }

    /**
     * Moving {@code hours} from source to target keeps the mean and changes the
     * sum of squared loads by {@code 2h(h - (source - target))}, which is
     * negative only while the hours stay below the gap between the two.
     */
    private static boolean narrowsGap(WorkerLoad source, WorkerLoad target, double hours) {
        return hours < source.assignedHours() - target.assignedHours();
    }

    private static double overloadAmount(WorkerLoad worker, double mean) {
        return worker.assignedHours() - mean * worker.allocationPercentage() / 100;
    }

    private static long subtaskCount(Task task, List<Subtask> subtasks) {
        return subtasks.stream().filter(s -> task.id().equals(s.parentTaskId())).count();
    }
}
