package com.fleetrun.worker.runtime;

import com.fleetrun.core.model.ScenarioStatus;

import java.util.List;
import java.util.Map;

/**
 * What a {@link ScenarioExecutor} reports back. The runtime adds the duration.
 *
 * @param name       scenario name as executed (placeholders interpolated), may be {@code null}
 * @param status     passed, failed or skipped
 * @param error      error message, if any
 * @param stackTrace stack detail, if any
 * @param artifacts  artifact references grouped by kind
 * @param testData   example values actually used
 */
public record ExecutionOutcome(
    String name,
    ScenarioStatus status,
    String error,
    String stackTrace,
    Map<String, List<String>> artifacts,
    Map<String, String> testData
) {

    public static ExecutionOutcome passed(String name, Map<String, String> testData) {
        return new ExecutionOutcome(name, ScenarioStatus.PASSED, null, null, Map.of(), testData);
    }

    public static ExecutionOutcome failed(String name, String error, Map<String, String> testData) {
        return new ExecutionOutcome(name, ScenarioStatus.FAILED, error, null, Map.of(), testData);
    }
}
