package com.fleetrun.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Resolves how many workers a run may use.
 *
 * <p>Order: explicit argument, {@code PARALLEL_WORKERS} environment variable,
 * configured {@code fleetrun.worker.max-workers}, available processors.
 * The pool then caps this at the number of work items.
 */
public final class WorkerCounts {

    private static final Logger log = LoggerFactory.getLogger(WorkerCounts.class);

    public static final String ENV_OVERRIDE = "PARALLEL_WORKERS";

    private WorkerCounts() {}

    public static int resolve(Integer explicit, Map<String, String> env, int configured, int processors) {
        if (explicit != null && explicit > 0) {
            return explicit;
        }
        String fromEnv = env.get(ENV_OVERRIDE);
        if (fromEnv != null && !fromEnv.isBlank()) {
            try {
                int n = Integer.parseInt(fromEnv.trim());
                if (n > 0) {
                    return n;
                }
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric {}={}", ENV_OVERRIDE, fromEnv);
            }
        }
        if (configured > 0) {
            return configured;
        }
        return Math.max(1, processors);
    }

    public static int poolSize(int maxWorkers, int totalItems) {
        return Math.min(maxWorkers, totalItems);
    }
}
