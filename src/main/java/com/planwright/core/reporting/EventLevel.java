package com.planwright.core.reporting;

import org.slf4j.event.Level;

import java.util.Locale;

/**
 * Severity of a recorded event, ordered DEBUG &lt; INFO &lt; WARN &lt; ERROR.
 */
public enum EventLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public boolean isAtLeast(EventLevel threshold) {
        return compareTo(threshold) >= 0;
    }

    public String fileToken() {
        return name().toLowerCase(Locale.ROOT);
    }

    public Level toSlf4j() {
        return Level.valueOf(name());
    }
}
