package com.planwright.core.scheduler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable workload of one worker during a scheduling run.
 * {@link #remainingHours()} is always derived from the total and the assigned hours.
 */
public class WorkerLoad {

    private final WorkerProfile profile;
    private final double totalAvailableHours;
    private final double allocationPercentage;
    private final HistoricalPerformance historicalPerformance;
    private final List<String> taskIds = new ArrayList<>();
    private final List<String> subtaskIds = new ArrayList<>();
    private final List<WorkHistoryEntry> workHistory = new ArrayList<>();
    private double assignedHours;

    public WorkerLoad(WorkerProfile profile, EffectiveAvailability availability) {
        this.profile = profile;
        this.totalAvailableHours = availability.hoursPerWeek();
        this.allocationPercentage = availability.allocationPercentage();
        this.historicalPerformance = availability.historicalPerformance();
    }

    public String id() {
        return profile.id();
    }

    public WorkerProfile profile() {
        return profile;
    }

    public double totalAvailableHours() {
        return totalAvailableHours;
    }

    public double assignedHours() {
        return assignedHours;
    }

    public double remainingHours() {
        return totalAvailableHours - assignedHours;
    }

    public double allocationPercentage() {
        return allocationPercentage;
    }

    public HistoricalPerformance historicalPerformance() {
        return historicalPerformance;
    }

    public List<String> taskIds() {
        return Collections.unmodifiableList(taskIds);
    }

    public List<String> subtaskIds() {
        return Collections.unmodifiableList(subtaskIds);
    }

    public List<WorkHistoryEntry> workHistory() {
        return Collections.unmodifiableList(workHistory);
    }

    /** True when the worker has spare hours and they cover {@code hours}. */
    public boolean canAbsorb(double hours) {
        return remainingHours() > 0 && remainingHours() >= hours;
    }

    void add(String itemId, boolean subtask, double hours) {
        assignedHours += hours;
        (subtask ? subtaskIds : taskIds).add(itemId);
    }

    void remove(String itemId, boolean subtask, double hours) {
        assignedHours -= hours;
        (subtask ? subtaskIds : taskIds).remove(itemId);
    }

    void record(WorkHistoryEntry entry) {
        workHistory.add(entry);
    }
}
