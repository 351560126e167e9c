package com.fleetrun.core.publish;

import com.fleetrun.core.model.IterationOutcome;
import com.fleetrun.core.model.ResultData;
import com.fleetrun.core.model.ScenarioResult;
import com.fleetrun.core.model.ScenarioStatus;
import com.fleetrun.core.model.WorkItem;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * One logical scenario outcome handed to a {@link ResultPublisher}.
 *
 * @param scenarioName    scenario name (base name for consolidated results)
 * @param featureName     owning feature
 * @param status          passed, failed or skipped
 * @param durationMs      duration, summed over iterations for consolidated results
 * @param error           representative error message
 * @param artifacts       artifact references grouped by kind
 * @param stackTrace      representative stack detail
 * @param iterationNumber set only when a single iteration is published on its own
 * @param iterationData   per-iteration outcomes of a consolidated result, sorted by iteration
 * @param summaryComment  bounded human-readable summary of a consolidated result
 * @param tags            scenario tags, for publishers that map tags to external ids
 */
public record PublishRequest(
    String scenarioName,
    String featureName,
    ScenarioStatus status,
    long durationMs,
    String error,
    Map<String, List<String>> artifacts,
    String stackTrace,
    Integer iterationNumber,
    List<IterationOutcome> iterationData,
    String summaryComment,
    List<String> tags
) implements Serializable {

    public PublishRequest {
        artifacts = ResultData.artifacts(artifacts);
        iterationData = iterationData != null ? List.copyOf(iterationData) : List.of();
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public static PublishRequest single(WorkItem item, ScenarioResult result) {
        return new PublishRequest(item.scenarioName(), item.featureName(), result.status(),
                result.durationMs(), result.error(), result.artifacts(), result.stackTrace(),
                null, List.of(), null, item.scenario().tags());
    }

    public boolean isConsolidated() {
        return !iterationData.isEmpty();
    }
}
