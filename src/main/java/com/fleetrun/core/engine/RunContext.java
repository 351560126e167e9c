package com.fleetrun.core.engine;

import com.fleetrun.core.model.RunReport;
import com.fleetrun.core.model.RunState;
import com.fleetrun.core.model.ScenarioKey;
import com.fleetrun.core.model.ScenarioResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one run: the result set and its counters.
 *
 * <p>Everything except {@link #state()} is confined to the run's coordinator thread.
 */
public class RunContext {

    private final String runId;
    private final int totalItems;
    private final long startedAt = System.currentTimeMillis();
    private final Map<String, ScenarioResult> results = new LinkedHashMap<>();
    private int completed;
    private int published;
    private int workersStarted;
    private boolean timedOut;
    private volatile RunState state = RunState.BUILDING;

    public RunContext(String runId, int totalItems) {
        this.runId = runId;
        this.totalItems = totalItems;
    }

    public String runId() { return runId; }
    public int totalItems() { return totalItems; }
    public int completed() { return completed; }
    public int published() { return published; }
    public boolean timedOut() { return timedOut; }
    public RunState state() { return state; }

    public void state(RunState next) {
        this.state = next;
    }

    /**
     * Records the result for an item. A second result for the same item is refused.
     *
     * @return false if the item already had a result
     */
    public boolean record(ScenarioResult result) {
        return results.putIfAbsent(result.workItemId(), result) == null;
    }

    public boolean hasResult(String workItemId) {
        return results.containsKey(workItemId);
    }

    public Map<String, ScenarioResult> results() {
        return Collections.unmodifiableMap(results);
    }

    public int incrementCompleted() {
        return ++completed;
    }

    public void incrementPublished() {
        published++;
    }

    public void workersStarted(int count) {
        this.workersStarted = count;
    }

    public void markTimedOut() {
        this.timedOut = true;
    }

    public boolean isComplete() {
        return completed >= totalItems;
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startedAt;
    }

    public RunReport toReport(List<ScenarioKey> unflushed) {
        return new RunReport(runId, totalItems, completed, workersStarted, timedOut,
                results, published, unflushed, elapsedMs());
    }
}
