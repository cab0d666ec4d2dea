package com.planwright.core.reporting;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "planwright.reporting")
public class ReportingProperties {

    /** Directory for the application log and the error and event records; read by logback-spring.xml. */
    private String logPath = "./logs";

    /** Events below this level are not written to the event log. */
    private EventLevel eventThreshold = EventLevel.INFO;

    /** Include stack traces in the console summary of reported errors. */
    private boolean detailedConsoleErrors = false;

    public String getLogPath() {
        return logPath;
    }

    public void setLogPath(String logPath) {
        this.logPath = logPath;
    }

    public EventLevel getEventThreshold() {
        return eventThreshold;
    }

    public void setEventThreshold(EventLevel eventThreshold) {
        this.eventThreshold = eventThreshold;
    }

    public boolean isDetailedConsoleErrors() {
        return detailedConsoleErrors;
    }

    public void setDetailedConsoleErrors(boolean detailedConsoleErrors) {
        this.detailedConsoleErrors = detailedConsoleErrors;
    }
}
