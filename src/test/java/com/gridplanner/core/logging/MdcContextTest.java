package com.gridplanner.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.YearMonth;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setLayoutRun puts layoutRunId in MDC")
    void setLayoutRun() {
        MdcContext.setLayoutRun("LAYOUT-2024-0001");
        assertEquals("LAYOUT-2024-0001", MDC.get("layoutRunId"));
        assertNull(MDC.get("layoutMonth"));
    }

    @Test
    @DisplayName("setMonth puts layoutRunId and layoutMonth in MDC")
    void setMonth() {
        MdcContext.setMonth("LAYOUT-2024-0002", YearMonth.of(2024, 2));
        assertEquals("LAYOUT-2024-0002", MDC.get("layoutRunId"));
        assertEquals("2024-02", MDC.get("layoutMonth"));
    }

    @Test
    @DisplayName("clear removes all layout MDC keys")
    void clear() {
        MdcContext.setMonth("LAYOUT-2024-0003", YearMonth.of(2024, 3));
        MdcContext.clear();
        assertNull(MDC.get("layoutRunId"));
        assertNull(MDC.get("layoutMonth"));
    }
}
