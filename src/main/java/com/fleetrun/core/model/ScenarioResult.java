package com.fleetrun.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Recorded outcome of one {@link WorkItem}.
 *
 * @param workItemId      the item this result belongs to
 * @param scenarioName    scenario name as reported by the worker (may be interpolated)
 * @param featureName     owning feature name
 * @param workerId        worker that produced the result, {@code null} if never dispatched
 * @param status          passed, failed or skipped
 * @param durationMs      execution time reported by the worker
 * @param error           error message, if any
 * @param stackTrace      stack detail, if any
 * @param artifacts       artifact references grouped by kind (screenshots, videos, logs, ...)
 * @param testData        example values actually used by the worker
 * @param iterationNumber iteration of the parent outline, {@code null} for plain scenarios
 * @param degraded        true when the orchestrator synthesized this result without a worker report
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScenarioResult(
    String workItemId,
    String scenarioName,
    String featureName,
    Integer workerId,
    ScenarioStatus status,
    long durationMs,
    String error,
    String stackTrace,
    Map<String, List<String>> artifacts,
    Map<String, String> testData,
    Integer iterationNumber,
    boolean degraded
) implements Serializable {

    public ScenarioResult {
        artifacts = ResultData.artifacts(artifacts);
        testData = ResultData.testData(testData);
    }

    /**
     * Builds a result the orchestrator could not obtain from a worker.
     */
    public static ScenarioResult degraded(WorkItem item, Integer workerId, ScenarioStatus status, String reason) {
        return new ScenarioResult(item.id(), item.scenarioName(), item.featureName(), workerId,
                status, 0L, reason, null, Map.of(), item.exampleData(), item.iterationNumber(), true);
    }

    public boolean failed() {
        return status == ScenarioStatus.FAILED;
    }
}
