package com.planwright.core.scheduler;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tuning knobs for resource assignment and workload rebalancing.
 */
@Component
@ConfigurationProperties(prefix = "planwright.scheduler")
public class SchedulerProperties {

    private double skillWeight = 0.35;
    private double roleWeight = 0.20;
    private double availabilityWeight = 0.15;
    private double workloadWeight = 0.10;
    private double historyWeight = 0.10;
    private double specialtyWeight = 0.10;

    /** Rebalancing starts when the standard deviation exceeds this share of the mean. */
    private double imbalanceThreshold = 0.15;
    private double overloadFactor = 1.2;
    private double underloadFactor = 0.8;
    /** Share of a worker's overload that rebalancing tries to move away. */
    private double reallocationTarget = 0.8;
    /** Below this share of the target, individual subtasks are moved as well. */
    private double subtaskFallbackFraction = 0.5;
    private double minMatchScore = 0.4;
    private double minSubtaskHoursToMove = 2.0;

    private double defaultWeeklyHours = 40;
    private int overallocatedPercent = 95;
    private int underallocatedPercent = 50;
    /** Task count at which the workload-balance score reaches zero. */
    private int workloadNormalizer = 10;

    public double getSkillWeight() {
        return skillWeight;
    }

    public void setSkillWeight(double skillWeight) {
        this.skillWeight = skillWeight;
    }

    public double getRoleWeight() {
        return roleWeight;
    }

    public void setRoleWeight(double roleWeight) {
        this.roleWeight = roleWeight;
    }

    public double getAvailabilityWeight() {
        return availabilityWeight;
    }

    public void setAvailabilityWeight(double availabilityWeight) {
        this.availabilityWeight = availabilityWeight;
    }

    public double getWorkloadWeight() {
        return workloadWeight;
    }

    public void setWorkloadWeight(double workloadWeight) {
        this.workloadWeight = workloadWeight;
    }

    public double getHistoryWeight() {
        return historyWeight;
    }

    public void setHistoryWeight(double historyWeight) {
        this.historyWeight = historyWeight;
    }

    public double getSpecialtyWeight() {
        return specialtyWeight;
    }

    public void setSpecialtyWeight(double specialtyWeight) {
        this.specialtyWeight = specialtyWeight;
    }

    public double getImbalanceThreshold() {
        return imbalanceThreshold;
    }

    public void setImbalanceThreshold(double imbalanceThreshold) {
        this.imbalanceThreshold = imbalanceThreshold;
    }

    public double getOverloadFactor() {
        return overloadFactor;
    }

    public void setOverloadFactor(double overloadFactor) {
        this.overloadFactor = overloadFactor;
    }

    public double getUnderloadFactor() {
        return underloadFactor;
    }

    public void setUnderloadFactor(double underloadFactor) {
        this.underloadFactor = underloadFactor;
    }

    public double getReallocationTarget() {
        return reallocationTarget;
    }

    public void setReallocationTarget(double reallocationTarget) {
        this.reallocationTarget = reallocationTarget;
    }

    public double getSubtaskFallbackFraction() {
        return subtaskFallbackFraction;
    }

    public void setSubtaskFallbackFraction(double subtaskFallbackFraction) {
        this.subtaskFallbackFraction = subtaskFallbackFraction;
    }

    public double getMinMatchScore() {
        return minMatchScore;
    }

    public void setMinMatchScore(double minMatchScore) {
        this.minMatchScore = minMatchScore;
    }

    public double getMinSubtaskHoursToMove() {
        return minSubtaskHoursToMove;
    }

    public void setMinSubtaskHoursToMove(double minSubtaskHoursToMove) {
        this.minSubtaskHoursToMove = minSubtaskHoursToMove;
    }

    public double getDefaultWeeklyHours() {
        return defaultWeeklyHours;
    }

    public void setDefaultWeeklyHours(double defaultWeeklyHours) {
        this.defaultWeeklyHours = defaultWeeklyHours;
    }

    public int getOverallocatedPercent() {
        return overallocatedPercent;
    }

    public void setOverallocatedPercent(int overallocatedPercent) {
        this.overallocatedPercent = overallocatedPercent;
    }

    public int getUnderallocatedPercent() {
        return underallocatedPercent;
    }

    public void setUnderallocatedPercent(int underallocatedPercent) {
        this.underallocatedPercent = underallocatedPercent;
    }

    public int getWorkloadNormalizer() {
        return workloadNormalizer;
    }

    public void setWorkloadNormalizer(int workloadNormalizer) {
        this.workloadNormalizer = workloadNormalizer;
    }
}
