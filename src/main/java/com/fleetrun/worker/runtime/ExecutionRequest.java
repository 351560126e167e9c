package com.fleetrun.worker.runtime;

import com.fleetrun.core.model.Feature;
import com.fleetrun.core.model.Scenario;
import com.fleetrun.worker.protocol.WorkerMessage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a {@link ScenarioExecutor} is asked to run.
 *
 * @param scenarioId      work item id, echoed back in the result
 * @param feature         owning feature
 * @param scenario        scenario with background steps attached
 * @param config          configuration snapshot from the coordinator
 * @param exampleData     example values keyed by header, empty for plain scenarios
 * @param iterationNumber 1-based iteration, {@code null} for plain scenarios
 * @param totalIterations iteration count, {@code null} for plain scenarios
 */
public record ExecutionRequest(
    String scenarioId,
    Feature feature,
    Scenario scenario,
    Map<String, String> config,
    Map<String, String> exampleData,
    Integer iterationNumber,
    Integer totalIterations
) {

    public ExecutionRequest {
        config = config != null ? Map.copyOf(config) : Map.of();
        exampleData = exampleData != null ? Collections.unmodifiableMap(new LinkedHashMap<>(exampleData)) : Map.of();
    }

    static ExecutionRequest from(WorkerMessage.Execute execute) {
        var data = new LinkedHashMap<String, String>();
        if (execute.exampleHeaders() != null && execute.exampleRow() != null) {
            for (int i = 0; i < execute.exampleHeaders().size(); i++) {
                String value = i < execute.exampleRow().size() ? execute.exampleRow().get(i) : "";
                data.put(execute.exampleHeaders().get(i), value);
            }
        }
        return new ExecutionRequest(execute.scenarioId(), execute.feature(), execute.scenario(),
                execute.config(), data, execute.iterationNumber(), execute.totalIterations());
    }

    public boolean isIteration() {
        return iterationNumber != null;
    }
}
