package com.planwright.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for pipeline runs and scheduling.
 */
@Service
public class PlanningMetrics {

    private final MeterRegistry registry;

    public PlanningMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStageDuration(String stage, long ms, boolean success) {
        Timer.builder("planwright.stage.duration")
                .tag("stage", stage)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordStageAttempts(String stage, int attempts) {
        DistributionSummary.builder("planwright.stage.attempts")
                .tag("stage", stage)
                .register(registry)
                .record(attempts);
    }

    public void recordRunResult(String status) {
        Counter.builder("planwright.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordResume() {
        Counter.builder("planwright.runs.resumed")
                .description("Runs continued from a checkpoint")
                .register(registry)
                .increment();
    }

    /**
     * Records a checkpoint write that failed after its stage succeeded.
     */
    public void recordCheckpointFailure(String stage) {
        Counter.builder("planwright.checkpoint.failures")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void recordReassignments(int count) {
        DistributionSummary.builder("planwright.scheduler.reassignments")
                .description("Items moved by workload rebalancing per run")
                .register(registry)
                .record(count);
    }

    public void recordUnassigned(int count) {
        Counter.builder("planwright.scheduler.unassigned")
                .description("Tasks and subtasks no worker could take")
                .register(registry)
                .increment(count);
    }
}
