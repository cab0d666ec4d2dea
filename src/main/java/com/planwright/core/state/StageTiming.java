package com.planwright.core.state;

import java.io.Serializable;
import java.time.Instant;

/**
 * Timing of the most recent execution of one stage.
 *
 * @param attempts number of invocations, including the first
 * @param failed   true when the stage ended in an unrecoverable error
 */
public record StageTiming(
    Instant startTime,
    Instant endTime,
    long durationMs,
    int attempts,
    boolean failed
) implements Serializable {}
