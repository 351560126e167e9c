package com.fleetrun.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a caller gets back from a run.
 *
 * <p>{@code results} holds an entry for every enqueued work item, keyed by item id.
 * Entries flagged {@link ScenarioResult#degraded()} were synthesized by the orchestrator
 * (disconnect, deadline, no workers left) and carry no worker detail.
 *
 * @param runId           run identifier
 * @param totalItems      number of work items enqueued
 * @param completedItems  items accounted for by a worker result or a disconnect
 * @param workersStarted  workers that completed the readiness handshake
 * @param timedOut        true when draining ended on the global deadline
 * @param results         per-item results in completion order
 * @param publishedCount  publisher invocations (singles plus consolidated results)
 * @param unflushed       parent scenarios whose iterations never all arrived
 * @param elapsedMs       wall-clock duration of the run
 */
public record RunReport(
    String runId,
    int totalItems,
    int completedItems,
    int workersStarted,
    boolean timedOut,
    Map<String, ScenarioResult> results,
    int publishedCount,
    List<ScenarioKey> unflushed,
    long elapsedMs
) implements Serializable {

    public RunReport {
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        unflushed = List.copyOf(unflushed);
    }

    public static RunReport empty(String runId) {
        return new RunReport(runId, 0, 0, 0, false, Map.of(), 0, List.of(), 0L);
    }

    public long countByStatus(ScenarioStatus status) {
        return results.values().stream().filter(r -> r.status() == status).count();
    }

    public long degradedCount() {
        return results.values().stream().filter(ScenarioResult::degraded).count();
    }

    public boolean hasFailures() {
        return countByStatus(ScenarioStatus.FAILED) > 0;
    }
}
