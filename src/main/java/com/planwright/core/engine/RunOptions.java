package com.planwright.core.engine;

/**
 * @param resume continue from the latest checkpoint when one exists
 */
public record RunOptions(boolean resume) {

    public static RunOptions defaults() {
        return new RunOptions(true);
    }

    public static RunOptions fresh() {
        return new RunOptions(false);
    }
}
