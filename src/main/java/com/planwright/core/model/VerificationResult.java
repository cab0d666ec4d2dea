package com.planwright.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Consistency report over a compiled plan. The plan is valid when no issue has
 * severity {@link Severity#ERROR}.
 */
public record VerificationResult(
    boolean valid,
    List<Issue> issues,
    int taskCount,
    int subtaskCount,
    double totalEstimatedHours
) implements Serializable {

    public VerificationResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public long errorCount() {
        return issues.stream().filter(i -> i.severity() == Severity.ERROR).count();
    }

    public enum Severity { ERROR, WARNING }

    /**
     * @param code   stable machine-readable code, e.g. "UNKNOWN_DEPENDENCY"
     * @param itemId task or subtask concerned (nullable)
     */
    public record Issue(
        Severity severity,
        String code,
        String message,
        String itemId
    ) implements Serializable {}
}
