package com.planwright.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Priority label of a task or subtask. Lower {@link #rank()} sorts first.
 */
public enum Priority {
    CRITICAL("Critical", 0),
    HIGH("High", 1),
    MEDIUM("Medium", 2),
    LOW("Low", 3);

    private final String label;
    private final int rank;

    Priority(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public int rank() {
        return rank;
    }

    /**
     * Lenient parse used for model output: unknown or blank values map to {@link #MEDIUM}.
     */
    @JsonCreator
    public static Priority from(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        String normalized = value.trim();
        for (Priority p : values()) {
            if (p.label.equalsIgnoreCase(normalized) || p.name().equalsIgnoreCase(normalized)) {
                return p;
            }
        }
        return MEDIUM;
    }
}
