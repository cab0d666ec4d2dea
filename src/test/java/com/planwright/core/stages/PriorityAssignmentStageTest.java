package com.planwright.core.stages;

import com.planwright.core.model.Priority;
import com.planwright.core.model.PriorityAssignments;
import com.planwright.core.model.Subtask;
import com.planwright.core.model.Task;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PriorityAssignmentStageTest {

    private final PriorityAssignmentStage stage = new PriorityAssignmentStage();

    private static Task task(String id, double hours, Integer sprint, String... deps) {
        return new Task(id, "Task " + id, null, null, hours, null, List.of(deps), sprint, null, List.of());
    }

    private static Subtask subtask(String id, String parent, String... deps) {
        return new Subtask(id, parent, "Step " + id, null, null, 2, null, List.of(deps), null);
    }

    @Test
    @DisplayName("critical path, dependents and early sprints raise the score")
    void scoresTasks() {
        List<Task> tasks = List.of(
                task("A", 10, 1),
                task("B", 20, 1, "A"),
                task("C", 5, 2, "A"),
                task("D", 1, 10));
        List<Subtask> subtasks = List.of(
                subtask("C-S1", "C"),
                subtask("C-S2", "C", "C-S1"),
                subtask("D-S1", "D", "D-S0"),
                subtask("X-S1", "X"));

        PriorityAssignments result = stage.apply(new PriorityAssignmentStage.Input(tasks, subtasks));

        assertEquals(List.of("A", "B"), result.criticalPath());
        assertEquals(165, result.scores().get("A"));
        assertEquals(145, result.scores().get("B"));
        assertEquals(40, result.scores().get("C"));
        assertEquals(0, result.scores().get("D"));
        assertEquals(Priority.CRITICAL, result.tasks().get("A"));
        assertEquals(Priority.CRITICAL, result.tasks().get("B"));
        assertEquals(Priority.MEDIUM, result.tasks().get("C"));
        assertEquals(Priority.LOW, result.tasks().get("D"));

        assertEquals(Priority.MEDIUM, result.subtasks().get("C-S1"));
        assertEquals(Priority.HIGH, result.subtasks().get("C-S2"));
        assertEquals(Priority.MEDIUM, result.subtasks().get("D-S1"));
        assertEquals(Priority.MEDIUM, result.subtasks().get("X-S1"));
    }

    @Test
    @DisplayName("dependency cycles do not break path finding")
    void toleratesCycles() {
        List<Task> tasks = List.of(task("X", 8, null, "Y"), task("Y", 8, null, "X"), task("Z", 4, null));

        PriorityAssignments result = assertDoesNotThrow(
                () -> stage.apply(new PriorityAssignmentStage.Input(tasks, List.of())));

        assertEquals(List.of("Z"), result.criticalPath());
        assertEquals(Priority.CRITICAL, result.tasks().get("Z"));
        assertEquals(10, result.scores().get("X"));
    }

    @Test
    @DisplayName("unknown dependencies are ignored")
    void unknownDependencies() {
        PriorityAssignments result = stage.apply(new PriorityAssignmentStage.Input(
                List.of(task("A", 4, null, "GHOST")), List.of()));

        assertEquals(List.of("A"), result.criticalPath());
    }

    @Test
    void noTasks() {
        assertEquals(PriorityAssignments.empty(), stage.apply(new PriorityAssignmentStage.Input(List.of(), List.of())));
    }

    @Test
    void thresholds() {
        assertEquals(Priority.CRITICAL, PriorityAssignmentStage.fromScore(100));
        assertEquals(Priority.HIGH, PriorityAssignmentStage.fromScore(99));
        assertEquals(Priority.HIGH, PriorityAssignmentStage.fromScore(70));
        assertEquals(Priority.MEDIUM, PriorityAssignmentStage.fromScore(40));
        assertEquals(Priority.LOW, PriorityAssignmentStage.fromScore(39));
        assertEquals(Priority.CRITICAL, PriorityAssignmentStage.raise(Priority.CRITICAL));
        assertEquals(Priority.MEDIUM, PriorityAssignmentStage.raise(Priority.LOW));
    }
}
