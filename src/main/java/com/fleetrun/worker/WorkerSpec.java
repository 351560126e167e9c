package com.fleetrun.worker;

import java.util.Map;

/**
 * Everything needed to bring up one worker.
 *
 * @param workerId    stable numeric id, 1-based
 * @param runId       run the worker belongs to
 * @param environment environment variables for the worker (WORKER_ID, configured extras)
 */
public record WorkerSpec(
    int workerId,
    String runId,
    Map<String, String> environment
) {

    public WorkerSpec {
        environment = Map.copyOf(environment);
    }
}
