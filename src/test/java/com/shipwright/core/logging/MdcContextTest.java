package com.shipwright.core.logging;

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
    @DisplayName("setAttempt puts attemptId and environment in MDC")
    void setAttempt() {
        MdcContext.setAttempt("deploy_staging_1731578400", "staging");
        assertEquals("deploy_staging_1731578400", MDC.get("attemptId"));
        assertEquals("staging", MDC.get("environment"));
    }

    @Test
    @DisplayName("setStage puts stage in MDC")
    void setStage() {
        MdcContext.setStage("SMOKE_TESTING");
        assertEquals("SMOKE_TESTING", MDC.get("stage"));
    }

    @Test
    @DisplayName("clear removes all shipwright MDC keys and leaves others")
    void clear() {
        MDC.put("other", "kept");
        MdcContext.setAttempt("deploy_staging_1731578400", "staging");
        MdcContext.setStage("MONITORING");
        MdcContext.clear();
        assertNull(MDC.get("attemptId"));
        assertNull(MDC.get("environment"));
        assertNull(MDC.get("stage"));
        assertEquals("kept", MDC.get("other"));
        MDC.remove("other");
    }
}
