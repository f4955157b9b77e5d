package com.marketpulse.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void setStageAlsoSetsSession() {
        MdcContext.setStage("MP-1", "research");

        assertEquals("MP-1", MDC.get(MdcContext.SESSION_ID));
        assertEquals("research", MDC.get(MdcContext.STAGE));
    }

    @Test
    void clearStageKeepsSession() {
        MdcContext.setStage("MP-1", "research");
        MdcContext.clearStage();

        assertEquals("MP-1", MDC.get(MdcContext.SESSION_ID));
        assertNull(MDC.get(MdcContext.STAGE));
    }

    @Test
    void clearLeavesForeignKeys() {
        MDC.put("requestId", "r-1");
        MdcContext.setStage("MP-1", "synthesis");

        MdcContext.clear();

        assertNull(MDC.get(MdcContext.SESSION_ID));
        assertNull(MDC.get(MdcContext.STAGE));
        assertEquals("r-1", MDC.get("requestId"));
    }
}
