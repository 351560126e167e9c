package com.fleetrun.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Fleetrun-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setWorker(String runId, int workerId) {
        MDC.put("runId", runId);
        MDC.put("workerId", String.valueOf(workerId));
    }

    public static void setWorkItem(String runId, int workerId, String workItemId) {
        setWorker(runId, workerId);
        MDC.put("workItemId", workItemId);
    }

    public static void clearWorkItem() {
        MDC.remove("workerId");
        MDC.remove("workItemId");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("workerId");
        MDC.remove("workItemId");
    }
}
