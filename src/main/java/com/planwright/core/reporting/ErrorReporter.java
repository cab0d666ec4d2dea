package com.planwright.core.reporting;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planwright.core.retry.ErrorClassifier;
import com.planwright.core.state.PlanJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Issues error ids and writes error records and events as JSON lines.
 * <p>
 * Records go through two dedicated loggers that {@code logback-spring.xml}
 * binds to daily rolling files: {@value #ERROR_RECORDS} to
 * {@code error_yyyyMMdd.log}, and {@value #EVENT_RECORDS} to
 * {@code app_<level>_yyyyMMdd.log}, sifted on the {@value #EVENT_LEVEL_KEY}
 * MDC key. Events below the configured threshold are dropped here. Reporting
 * never throws: a record that cannot be built is logged at WARN and the id is
 * still returned.
 */
public class ErrorReporter {

    public static final String ERROR_RECORDS = "planwright.records.errors";
    public static final String EVENT_RECORDS = "planwright.records.events";
    public static final String EVENT_LEVEL_KEY = "eventLevel";

    private static final Logger log = LoggerFactory.getLogger(ErrorReporter.class);
    private static final Logger errorRecords = LoggerFactory.getLogger(ERROR_RECORDS);
    private static final Logger eventRecords = LoggerFactory.getLogger(EVENT_RECORDS);
    private static final String BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz";

    private final EventLevel eventThreshold;
    private final boolean detailedConsoleErrors;
    private final Clock clock;
    private final ObjectMapper mapper = PlanJson.mapper();

    public ErrorReporter(ReportingProperties properties, Clock clock) {
        this(properties.getEventThreshold(), properties.isDetailedConsoleErrors(), clock);
    }

    public ErrorReporter(EventLevel eventThreshold, boolean detailedConsoleErrors, Clock clock) {
        this.eventThreshold = eventThreshold == null ? EventLevel.INFO : eventThreshold;
        this.detailedConsoleErrors = detailedConsoleErrors;
        this.clock = clock;
    }

    /**
     * Records an error and returns its id, shaped {@code err_<epochMillis>_<5 base-36 chars>}.
     */
    public String logError(Throwable error, String context, Map<String, ?> metadata) {
        String errorId = newErrorId();
        String message = error == null ? "unknown error" : String.valueOf(error.getMessage());
        try {
            ObjectNode record = mapper.createObjectNode();
            record.put("errorId", errorId);
            record.put("timestamp", clock.instant().toString());
            record.put("context", context);
            record.put("message", message);
            if (error != null) {
                record.put("type", error.getClass().getName());
                String code = ErrorClassifier.errorCode(error);
                if (code != null) {
                    record.put("code", code);
                }
                record.put("stack", stackTrace(error));
                Throwable cause = error.getCause();
                if (cause != null && cause != error) {
                    ObjectNode causeNode = record.putObject("cause");
                    causeNode.put("type", cause.getClass().getName());
                    causeNode.put("message", cause.getMessage());
                }
            }
            if (metadata != null && !metadata.isEmpty()) {
                record.set("metadata", mapper.valueToTree(metadata));
            }
            errorRecords.error(mapper.writeValueAsString(record));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Could not write error record {}: {}", errorId, e.getMessage());
        }
        if (detailedConsoleErrors && error != null) {
            log.error("[{}] {}: {}", errorId, context, message, error);
        } else {
            log.error("[{}] {}: {}", errorId, context, message);
        }
        return errorId;
    }

    /**
     * Appends an event when {@code level} meets the configured threshold.
     */
    public void recordEvent(EventLevel level, String message, Map<String, ?> data) {
        if (level == null || !level.isAtLeast(eventThreshold)) {
            return;
        }
        try {
            ObjectNode record = mapper.createObjectNode();
            record.put("timestamp", clock.instant().toString());
            record.put("level", level.name());
            record.put("message", message);
            if (data != null && !data.isEmpty()) {
                record.set("data", mapper.valueToTree(data));
            }
            String line = mapper.writeValueAsString(record);
            try (MDC.MDCCloseable ignored = MDC.putCloseable(EVENT_LEVEL_KEY, level.fileToken())) {
                eventRecords.atLevel(level.toSlf4j()).log(line);
            }
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Could not write {} event '{}': {}", level, message, e.getMessage());
        }
    }

    public ErrorResponse formatErrorResponse(Throwable error, String context) {
        String errorId = logError(error, context, Map.of());
        String code = error == null ? null : ErrorClassifier.errorCode(error);
        String message = error == null ? "unknown error" : error.getMessage();
        return ErrorResponse.of(errorId, message, context, code != null ? code : "INTERNAL_ERROR");
    }

    public String newErrorId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder(5);
        for (int i = 0; i < 5; i++) {
            suffix.append(BASE36.charAt(random.nextInt(BASE36.length())));
        }
        return "err_" + clock.millis() + "_" + suffix;
    }

    private static String stackTrace(Throwable error) {
        StringWriter writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
