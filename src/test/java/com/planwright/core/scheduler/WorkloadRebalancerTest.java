package com.planwright.core.scheduler;

import com.planwright.core.model.BalanceStats;
import com.planwright.core.model.Priority;
import com.planwright.core.model.PriorityAssignments;
import com.planwright.core.model.Reassignment;
import com.planwright.core.model.Subtask;
import com.planwright.core.model.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkloadRebalancerTest {

    private final SchedulerProperties properties = new SchedulerProperties();
    private final MatchScorer scorer = new MatchScorer(properties);
    private final WorkloadRebalancer rebalancer = new WorkloadRebalancer(properties, scorer);
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-02T09:00:00Z"), ZoneOffset.UTC);

    private WorkerLoad alice;
    private WorkerLoad bob;
    private WorkerLoad carol;
    private WorkloadTracker tracker;
    private final List<Task> tasks = new ArrayList<>();
    private final List<Subtask> subtasks = new ArrayList<>();

    @BeforeEach
    void setUp() {
        alice = load("w1", "Alice", 60);
        bob = load("w2", "Bob", 40);
        carol = load("w3", "Carol", 40);
        tracker = new WorkloadTracker(List.of(alice, bob, carol), scorer, clock);
        tasks.clear();
        subtasks.clear();
    }

    private static WorkerLoad load(String id, String name, double hours) {
        return new WorkerLoad(new WorkerProfile(id, name, "Developer", List.of(), List.of()),
                new EffectiveAvailability(hours, 100, null));
    }

    // Titles avoid skill and critical keywords so every worker scores the same on skills.
    private Task task(String id, double hours, Priority priority, String owner) {
        Task task = new Task(id, "Item " + id, null, null, hours, priority, List.of(), 1, null, List.of());
        tasks.add(task);
        tracker.assign(task, owner);
        return task;
    }

    private Subtask subtask(String id, String parent, double hours, String owner) {
        Subtask subtask = new Subtask(id, parent, "Step " + id, null, null, hours, Priority.MEDIUM, List.of(), null);
        subtasks.add(subtask);
        tracker.assign(subtask, owner);
        return subtask;
    }

    private RebalanceReport rebalance() {
        return rebalancer.rebalance(tracker, tasks, subtasks, PriorityAssignments.empty());
    }

    @Nested
    @DisplayName("overloaded and underloaded workers")
    class ImbalanceTests {

        @Test
        @DisplayName("moving work lowers the spread of assigned hours")
        void reducesStandardDeviation() {
            for (int i = 1; i <= 4; i++) {
                task("A" + i, 10, Priority.MEDIUM, "w1");
            }
            task("B1", 4, Priority.MEDIUM, "w2");
            task("C1", 16, Priority.MEDIUM, "w3");

            RebalanceReport report = rebalance();

            assertTrue(report.triggered());
            assertEquals(20.0, report.initial().mean(), 1e-9);
            assertEquals(Math.sqrt(224.0), report.initial().standardDeviation(), 1e-9);
            assertTrue(report.result().standardDeviation() < report.initial().standardDeviation());
            assertEquals(2, report.reassignments().size());
            assertEquals(20.0, report.hoursMoved(), 1e-9);
            assertEquals(20.0, alice.assignedHours(), 1e-9);
            assertEquals(24.0, bob.assignedHours(), 1e-9);
            assertTrue(tracker.workers().stream().allMatch(w -> w.remainingHours() >= 0));
        }

        @Test
        @DisplayName("moves are written to both workers' history")
        void recordsHistory() {
            for (int i = 1; i <= 4; i++) {
                task("A" + i, 10, Priority.MEDIUM, "w1");
            }
            task("B1", 4, Priority.MEDIUM, "w2");
            task("C1", 16, Priority.MEDIUM, "w3");

            rebalance();

            assertEquals(2, alice.workHistory().size());
            assertTrue(alice.workHistory().stream().allMatch(e -> e.action().equals("reassigned")));
            assertEquals(2, bob.workHistory().size());
            assertTrue(bob.workHistory().stream().allMatch(e -> e.action().equals("assigned")));
            assertTrue(carol.workHistory().isEmpty());
        }

        @Test
        @DisplayName("a task carries its subtasks along and counts their hours")
        void cascadesSubtasks() {
            task("T1", 10, Priority.MEDIUM, "w1");
            subtask("T1-S1", "T1", 4, "w1");
            subtask("T1-S2", "T1", 4, "w1");
            task("T4", 20, Priority.HIGH, "w1");
            task("B1", 2, Priority.MEDIUM, "w2");
            task("C1", 20, Priority.MEDIUM, "w3");

            RebalanceReport report = rebalance();

            assertEquals(1, report.reassignments().size());
            Reassignment move = report.reassignments().get(0);
            assertEquals("T1", move.itemId());
            assertEquals("w2", move.toWorkerId());
            assertEquals(18.0, move.hours(), 1e-9);
            assertEquals(List.of("T1-S1", "T1-S2"), move.cascadedSubtasks());
            assertEquals(Map.of("T1-S1", "w2", "T1-S2", "w2"), tracker.subtaskOwners());
            assertEquals(0.0, report.result().standardDeviation(), 1e-9);
        }

        @Test
        @DisplayName("critical tasks stay put and subtasks move instead")
        void subtaskFallback() {
            task("T1", 30, Priority.HIGH, "w1");
            subtask("T1-S1", "T1", 4, "w1");
            subtask("T1-S2", "T1", 1, "w1");
            task("B1", 5, Priority.MEDIUM, "w2");
            task("C1", 20, Priority.MEDIUM, "w3");

            RebalanceReport report = rebalance();

            assertEquals(1, report.reassignments().size());
            Reassignment move = report.reassignments().get(0);
            assertEquals("T1-S1", move.itemId());
            assertEquals("subtask", move.itemType());
            assertEquals("w1", tracker.taskOwners().get("T1"));
            assertEquals("w1", tracker.subtaskOwners().get("T1-S2"));
        }

        @Test
        @DisplayName("targets without room for the whole task are skipped")
        void respectsCapacity() {
            bob = load("w2", "Bob", 8);
            alice = load("w1", "Alice", 60);
            carol = load("w3", "Carol", 40);
            tracker = new WorkloadTracker(List.of(alice, bob, carol), scorer, clock);
            task("A1", 20, Priority.MEDIUM, "w1");
            task("A2", 20, Priority.MEDIUM, "w1");
            task("B1", 2, Priority.MEDIUM, "w2");
            task("C1", 18, Priority.MEDIUM, "w3");

            RebalanceReport report = rebalance();

            assertTrue(report.reassignments().isEmpty());
            assertEquals(2.0, bob.assignedHours(), 1e-9);
        }

        @Test
        @DisplayName("a task larger than the gap between the two workers stays put")
        void skipsTaskThatWouldOvershoot() {
            tracker = new WorkloadTracker(List.of(alice, bob), scorer, clock);
            task("A1", 5, Priority.MEDIUM, "w1");
            task("A2", 30, Priority.MEDIUM, "w1");
            task("B1", 1, Priority.MEDIUM, "w2");

            RebalanceReport report = rebalance();

            assertEquals(17.0, report.initial().standardDeviation(), 1e-9);
            assertEquals(1, report.reassignments().size());
            assertEquals("A1", report.reassignments().get(0).itemId());
            assertEquals("w1", tracker.taskOwners().get("A2"));
            assertEquals(30.0, alice.assignedHours(), 1e-9);
            assertEquals(6.0, bob.assignedHours(), 1e-9);
            assertEquals(12.0, report.result().standardDeviation(), 1e-9);
        }

        @Test
        @DisplayName("subtask moves stop at the reallocation target and never widen the spread")
        void boundsSubtaskMoves() {
            tracker = new WorkloadTracker(List.of(alice, bob), scorer, clock);
            task("T1", 1, Priority.HIGH, "w1");
            for (int i = 1; i <= 10; i++) {
                subtask("T1-S" + i, "T1", 3, "w1");
            }
            task("B1", 2, Priority.MEDIUM, "w2");

            RebalanceReport report = rebalance();

            assertEquals(14.5, report.initial().standardDeviation(), 1e-9);
            assertEquals(4, report.reassignments().size());
            assertTrue(report.reassignments().stream().allMatch(r -> r.itemType().equals("subtask")));
            assertEquals(19.0, alice.assignedHours(), 1e-9);
            assertEquals(14.0, bob.assignedHours(), 1e-9);
            assertEquals(2.5, report.result().standardDeviation(), 1e-9);
        }
    }

    @Nested
    @DisplayName("balanced teams")
    class BalancedTests {

        @Test
        @DisplayName("a spread within the threshold is left alone")
        void notTriggered() {
            task("A1", 20, Priority.MEDIUM, "w1");
            task("B1", 19, Priority.MEDIUM, "w2");
            task("C1", 21, Priority.MEDIUM, "w3");

            RebalanceReport report = rebalance();

            assertFalse(report.triggered());
            assertTrue(report.reassignments().isEmpty());
            assertEquals(report.initial(), report.result());
        }

        @Test
        @DisplayName("an idle team is left alone")
        void emptyTeam() {
            RebalanceReport report = rebalance();
            assertFalse(report.triggered());
            assertEquals(new BalanceStats(0, 0, 0, 0), report.initial());
        }
    }

    @Test
    @DisplayName("high priority and keyword-marked tasks are critical")
    void criticalTasks() {
        Task high = new Task("T1", "Item", null, null, 5, Priority.HIGH, List.of(), null, null, List.of());
        Task keyword = new Task("T2", "Core ledger", null, null, 5, Priority.LOW, List.of(), null, null, List.of());
        Task plain = new Task("T3", "Item", null, null, 5, Priority.LOW, List.of(), null, null, List.of());
        PriorityAssignments raised = new PriorityAssignments(Map.of("T3", Priority.CRITICAL), Map.of(), List.of(), Map.of());

        assertTrue(WorkloadRebalancer.isTaskCritical(high, PriorityAssignments.empty()));
        assertTrue(WorkloadRebalancer.isTaskCritical(keyword, PriorityAssignments.empty()));
        assertFalse(WorkloadRebalancer.isTaskCritical(plain, PriorityAssignments.empty()));
        assertTrue(WorkloadRebalancer.isTaskCritical(plain, raised));
    }
}
