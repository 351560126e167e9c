package com.fleetrun.core.model;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The atomic unit of scheduling: one scenario, or one iteration of a scenario outline.
 *
 * @param id              unique, monotonically assigned identifier (e.g. "work-7")
 * @param feature         owning feature
 * @param scenario        scenario to run, with the feature background attached
 * @param scenarioIndex   position of the scenario within its feature
 * @param key             parent identity used to aggregate iterations
 * @param exampleRow      example values for this iteration, {@code null} for plain scenarios
 * @param exampleHeaders  headers aligned with {@code exampleRow}
 * @param iterationNumber 1-based iteration, {@code null} for plain scenarios
 * @param totalIterations iteration count of the parent, {@code null} for plain scenarios
 */
public record WorkItem(
    String id,
    Feature feature,
    Scenario scenario,
    int scenarioIndex,
    ScenarioKey key,
    List<String> exampleRow,
    List<String> exampleHeaders,
    Integer iterationNumber,
    Integer totalIterations
) implements Serializable {

    public WorkItem {
        if ((iterationNumber == null) != (totalIterations == null)) {
            throw new IllegalArgumentException(
                    "iterationNumber and totalIterations must be set together for " + id);
        }
        exampleRow = exampleRow != null ? List.copyOf(exampleRow) : null;
        exampleHeaders = exampleHeaders != null ? List.copyOf(exampleHeaders) : null;
    }

    public boolean isIteration() {
        return iterationNumber != null;
    }

    public String featureName() {
        return feature.name();
    }

    public String scenarioName() {
        return scenario.name();
    }

    /**
     * Example values keyed by header, in header order. Empty for plain scenarios.
     */
    public Map<String, String> exampleData() {
        var data = new LinkedHashMap<String, String>();
        if (exampleRow == null || exampleHeaders == null) {
            return data;
        }
        for (int i = 0; i < exampleHeaders.size(); i++) {
            data.put(exampleHeaders.get(i), i < exampleRow.size() ? exampleRow.get(i) : "");
        }
        return data;
    }
}
