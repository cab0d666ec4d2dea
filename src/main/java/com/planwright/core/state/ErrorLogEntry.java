package com.planwright.core.state;

import java.io.Serializable;
import java.time.Instant;

/**
 * @param errorId id issued by the error reporter, links to the error log file
 */
public record ErrorLogEntry(
    Instant timestamp,
    String message,
    String stage,
    String errorId
) implements Serializable {}
