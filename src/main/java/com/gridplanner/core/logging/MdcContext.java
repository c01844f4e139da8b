package com.gridplanner.core.logging;

import org.slf4j.MDC;

import java.time.YearMonth;

/**
 * Utility for managing layout-run MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String LAYOUT_RUN_ID = "layoutRunId";
    public static final String LAYOUT_MONTH = "layoutMonth";

    private MdcContext() {}

    public static void setLayoutRun(String layoutRunId) {
        MDC.put(LAYOUT_RUN_ID, layoutRunId);
    }

    public static void setMonth(String layoutRunId, YearMonth month) {
        MDC.put(LAYOUT_RUN_ID, layoutRunId);
        MDC.put(LAYOUT_MONTH, month.toString());
    }

    public static void clear() {
        MDC.remove(LAYOUT_RUN_ID);
        MDC.remove(LAYOUT_MONTH);
    }
}
