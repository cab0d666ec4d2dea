package com.planwright.core.stages;

import com.planwright.core.model.BalanceStats;
import com.planwright.core.model.CompiledPlan;
import com.planwright.core.model.CompiledPlan.SprintView;
import com.planwright.core.model.CompiledPlan.SubtaskView;
import com.planwright.core.model.CompiledPlan.TaskView;
import com.planwright.core.model.Priority;
import com.planwright.core.model.Risk;
import com.planwright.core.model.Subtask;
import com.planwright.core.model.VerificationResult;
import com.planwright.core.model.VerificationResult.Issue;
import com.planwright.core.model.VerificationResult.Severity;
import com.planwright.core.model.WorkerStats;
import com.planwright.core.model.WorkloadSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VerificationStageTest {

    private final VerificationStage stage = new VerificationStage();

    private static final List<Risk> RISKS = List.of(new Risk("Scope creep", "High", "Freeze scope"));

    private static SprintView sprint(int number, int start, int end, double planned, double capacity) {
        return new SprintView(number, "Sprint " + number, null, start, end, List.of(), planned, capacity);
    }

    private static TaskView task(String id, String assignee, Integer sprint, List<String> deps,
                                 List<SubtaskView> subtasks) {
        return new TaskView(id, "Task " + id, null, null, 8, Priority.MEDIUM, assignee, sprint, deps, false, subtasks);
    }

    private static CompiledPlan plan(List<SprintView> sprints, List<TaskView> tasks, List<Risk> risks,
                                     WorkloadSummary allocation) {
        return new CompiledPlan(null, null, sprints, tasks, risks, null, allocation, null);
    }

    private static List<String> codes(VerificationResult result) {
        return result.issues().stream().map(Issue::code).toList();
    }

    @Test
    @DisplayName("a consistent plan is valid without issues")
    void validPlan() {
        TaskView t1 = task("TASK-001", "Alice", 1, List.of(),
                List.of(new SubtaskView("TASK-001-S1", "Step", 4, Priority.MEDIUM, "Alice", List.of())));
        TaskView t2 = task("TASK-002", "Bob", 2, List.of("TASK-001"), List.of());

        VerificationResult result = stage.apply(new VerificationStage.Input(
                plan(List.of(sprint(1, 1, 2, 8, 80), sprint(2, 3, 4, 8, 80)), List.of(t1, t2), RISKS, null),
                List.of(new Subtask("TASK-001-S1", "TASK-001", "Step", null, null, 4, null, List.of(), null))));

        assertTrue(result.valid());
        assertTrue(result.issues().isEmpty());
        assertEquals(2, result.taskCount());
        assertEquals(1, result.subtaskCount());
        assertEquals(16.0, result.totalEstimatedHours());
    }

    @Nested
    @DisplayName("errors make the plan invalid")
    class ErrorTests {

        @Test
        void emptyPlan() {
            VerificationResult result = stage.apply(new VerificationStage.Input(
                    plan(List.of(), List.of(), RISKS, null), List.of()));

            assertFalse(result.valid());
            assertEquals(List.of("NO_SPRINTS", "NO_TASKS"), codes(result));
            assertEquals(2, result.errorCount());
        }

        @Test
        @DisplayName("unknown dependencies and cycles are reported per task")
        void dependencies() {
            TaskView a = task("A", "Alice", 1, List.of("B", "GHOST"), List.of());
            TaskView b = task("B", "Alice", 1, List.of("A"), List.of(
                    new SubtaskView("B-S1", "Step", 2, Priority.LOW, "Alice", List.of("B-S9"))));

            VerificationResult result = stage.apply(new VerificationStage.Input(
                    plan(List.of(sprint(1, 1, 2, 16, 80)), List.of(a, b), RISKS, null), List.of()));

            assertFalse(result.valid());
            List<String> codes = codes(result);
            assertEquals(2, codes.stream().filter("UNKNOWN_DEPENDENCY"::equals).count());
            assertTrue(codes.contains("DEPENDENCY_CYCLE"));
            assertTrue(result.issues().stream()
                    .anyMatch(i -> i.code().equals("UNKNOWN_DEPENDENCY") && "B-S1".equals(i.itemId())));
        }

        @Test
        @DisplayName("subtasks whose parent is missing are orphans")
        void orphans() {
            VerificationResult result = stage.apply(new VerificationStage.Input(
                    plan(List.of(sprint(1, 1, 2, 8, 80)), List.of(task("A", "Alice", 1, List.of(), List.of())),
                            RISKS, null),
                    List.of(new Subtask("Z-S1", "Z", "Lost", null, null, 2, null, List.of(), null))));

            assertFalse(result.valid());
            Issue issue = result.issues().get(0);
            assertEquals("ORPHAN_SUBTASK", issue.code());
            assertEquals("Z-S1", issue.itemId());
        }
    }

    @Test
    @DisplayName("warnings leave the plan valid")
    void warnings() {
        WorkerStats busy = new WorkerStats("m1", "Alice", "Dev", 40, 40, 0, 100, 2, 0, true, false);
        WorkloadSummary allocation = new WorkloadSummary(List.of(busy), 1, 0, List.of(),
                new BalanceStats(0, 0, 0, 0), new BalanceStats(0, 0, 0, 0));
        TaskView unassigned = task("A", null, 3, List.of(),
                List.of(new SubtaskView("A-S1", "Step", 2, Priority.LOW, null, List.of())));

        VerificationResult result = stage.apply(new VerificationStage.Input(
                plan(List.of(sprint(1, 1, 2, 100, 80), sprint(2, 2, 3, 0, 80)), List.of(unassigned), List.of(),
                        allocation),
                List.of()));

        assertTrue(result.valid());
        assertTrue(result.issues().stream().allMatch(i -> i.severity() == Severity.WARNING));
        assertEquals(List.of("SPRINT_OVER_CAPACITY", "SPRINT_OVERLAP", "UNKNOWN_SPRINT", "UNASSIGNED", "UNASSIGNED",
                "OVERALLOCATED_WORKER", "NO_RISKS"), codes(result));
    }
}
