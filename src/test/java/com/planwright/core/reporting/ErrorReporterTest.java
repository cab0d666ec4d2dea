package com.planwright.core.reporting;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.planwright.core.state.PlanJson;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ErrorReporterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-15T10:00:00Z"), ZoneOffset.UTC);

    private ErrorReporter reporter;
    private ListAppender<ILoggingEvent> errorRecords;
    private ListAppender<ILoggingEvent> eventRecords;

    @BeforeEach
    void setUp() {
        reporter = new ErrorReporter(EventLevel.INFO, false, CLOCK);
        errorRecords = attach(ErrorReporter.ERROR_RECORDS);
        eventRecords = attach(ErrorReporter.EVENT_RECORDS);
    }

    @AfterEach
    void tearDown() {
        detach(ErrorReporter.ERROR_RECORDS, errorRecords);
        detach(ErrorReporter.EVENT_RECORDS, eventRecords);
    }

    private static ListAppender<ILoggingEvent> attach(String loggerName) {
        Logger logger = (Logger) LoggerFactory.getLogger(loggerName);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        logger.setLevel(Level.DEBUG);
        return appender;
    }

    private static void detach(String loggerName, ListAppender<ILoggingEvent> appender) {
        ((Logger) LoggerFactory.getLogger(loggerName)).detachAppender(appender);
        appender.stop();
    }

    private static JsonNode json(ILoggingEvent event) throws Exception {
        return PlanJson.mapper().readTree(event.getFormattedMessage());
    }

    @Nested
    @DisplayName("logError")
    class LogErrorTests {

        @Test
        @DisplayName("returns an id shaped err_<millis>_<suffix>")
        void errorIdShape() {
            String id = reporter.logError(new IllegalStateException("boom"), "test", Map.of());
            assertTrue(id.matches("err_" + CLOCK.millis() + "_[0-9a-z]{5}"), id);
        }

        @Test
        @DisplayName("writes one JSON record to the error records logger")
        void writesErrorRecord() throws Exception {
            String id = reporter.logError(new IllegalStateException("wrapper", new SocketTimeoutException("read")),
                    "proj_1:taskGeneration", Map.of("projectId", "proj_1"));

            assertEquals(1, errorRecords.list.size());
            assertEquals(Level.ERROR, errorRecords.list.get(0).getLevel());
            JsonNode record = json(errorRecords.list.get(0));
            assertEquals(id, record.get("errorId").asText());
            assertEquals("2026-03-15T10:00:00Z", record.get("timestamp").asText());
            assertEquals("proj_1:taskGeneration", record.get("context").asText());
            assertEquals("wrapper", record.get("message").asText());
            assertEquals(SocketTimeoutException.class.getName(), record.get("cause").get("type").asText());
            assertEquals("proj_1", record.get("metadata").get("projectId").asText());
            assertTrue(record.get("stack").asText().contains("IllegalStateException"));
        }

        @Test
        @DisplayName("issues distinct ids")
        void distinctIds() {
            String a = reporter.logError(new RuntimeException("a"), "ctx", Map.of());
            String b = reporter.logError(new RuntimeException("b"), "ctx", Map.of());
            assertNotEquals(a, b);
        }

        @Test
        @DisplayName("still returns an id when the metadata cannot be serialized")
        void neverThrows() {
            String id = reporter.logError(new RuntimeException("x"), "ctx", Map.of("raw", new Object()));

            assertNotNull(id);
            assertTrue(id.startsWith("err_"));
            assertTrue(errorRecords.list.isEmpty());
        }
    }

    @Nested
    @DisplayName("recordEvent")
    class RecordEventTests {

        @Test
        @DisplayName("writes events at or above the threshold at their own level")
        void writesEventsAboveThreshold() throws Exception {
            reporter.recordEvent(EventLevel.WARN, "Checkpoint save failed", Map.of("projectId", "p"));

            assertEquals(1, eventRecords.list.size());
            assertEquals(Level.WARN, eventRecords.list.get(0).getLevel());
            JsonNode record = json(eventRecords.list.get(0));
            assertEquals("WARN", record.get("level").asText());
            assertEquals("p", record.get("data").get("projectId").asText());
        }

        @Test
        @DisplayName("drops events below the threshold")
        void dropsEventsBelowThreshold() {
            reporter.recordEvent(EventLevel.DEBUG, "noise", Map.of());
            assertTrue(eventRecords.list.isEmpty());
        }

        @Test
        @DisplayName("the level key is only set while the event is written")
        void clearsLevelKey() {
            reporter.recordEvent(EventLevel.ERROR, "Project failed", Map.of());

            assertEquals(1, eventRecords.list.size());
            assertNull(MDC.get(ErrorReporter.EVENT_LEVEL_KEY));
        }
    }

    @Test
    @DisplayName("the logging setup sends records to dated, capped rolling files")
    void loggingSetupRollsRecordFiles() throws Exception {
        String config;
        try (InputStream in = getClass().getResourceAsStream("/logback-spring.xml")) {
            assertNotNull(in);
            config = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        assertTrue(config.contains("<logger name=\"" + ErrorReporter.ERROR_RECORDS + "\""));
        assertTrue(config.contains("<logger name=\"" + ErrorReporter.EVENT_RECORDS + "\""));
        assertTrue(config.contains("error_%d{yyyyMMdd}.log"));
        assertTrue(config.contains("app_${" + ErrorReporter.EVENT_LEVEL_KEY + "}_%d{yyyyMMdd}.log"));
        assertTrue(config.contains("<totalSizeCap>"));
    }

    @Test
    @DisplayName("formatErrorResponse wraps the error with its id and code")
    void formatErrorResponse() {
        ErrorResponse response = reporter.formatErrorResponse(new SocketTimeoutException("slow"), "llm");
        assertFalse(response.success());
        assertEquals("ETIMEDOUT", response.error().code());
        assertEquals("llm", response.error().context());
        assertTrue(response.error().id().startsWith("err_"));

        ErrorResponse generic = reporter.formatErrorResponse(new IllegalStateException("x"), "ctx");
        assertEquals("INTERNAL_ERROR", generic.error().code());
    }

    @Test
    @DisplayName("event levels are ordered and map onto logging levels")
    void eventLevelOrdering() {
        assertTrue(EventLevel.ERROR.isAtLeast(EventLevel.WARN));
        assertFalse(EventLevel.DEBUG.isAtLeast(EventLevel.INFO));
        assertEquals("info", EventLevel.INFO.fileToken());
        assertEquals(org.slf4j.event.Level.WARN, EventLevel.WARN.toSlf4j());
    }
}
