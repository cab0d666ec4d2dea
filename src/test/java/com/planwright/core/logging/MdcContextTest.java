package com.planwright.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setProject puts projectId in MDC and drops stage keys")
    void setProject() {
        MdcContext.setStage("atlas", "taskGeneration");
        MdcContext.setAttempt(2);

        MdcContext.setProject("beacon");

        assertEquals("beacon", MDC.get("projectId"));
        assertNull(MDC.get("stage"));
        assertNull(MDC.get("attempt"));
    }

    @Test
    @DisplayName("setStage puts projectId and stage in MDC and resets the attempt")
    void setStage() {
        MdcContext.setAttempt(3);
        MdcContext.setStage("atlas", "sprintPlanning");

        assertEquals("atlas", MDC.get("projectId"));
        assertEquals("sprintPlanning", MDC.get("stage"));
        assertNull(MDC.get("attempt"));
    }

    @Test
    void setAttempt() {
        MdcContext.setAttempt(1);
        assertEquals("1", MDC.get("attempt"));
    }

    @Test
    @DisplayName("clear removes all planwright MDC keys and keeps others")
    void clear() {
        MDC.put("requestId", "r-1");
        MdcContext.setStage("atlas", "verification");
        MdcContext.setAttempt(2);

        MdcContext.clear();

        assertNull(MDC.get("projectId"));
        assertNull(MDC.get("stage"));
        assertNull(MDC.get("attempt"));
        assertEquals("r-1", MDC.get("requestId"));
        MDC.remove("requestId");
    }
}
