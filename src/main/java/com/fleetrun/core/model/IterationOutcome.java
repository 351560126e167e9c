package com.fleetrun.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.Map;

/**
 * One iteration's contribution to a consolidated data-driven result.
 *
 * @param iteration   1-based iteration number
 * @param status      iteration outcome
 * @param durationMs  iteration duration
 * @param error       error message, if the iteration failed
 * @param stackTrace  stack detail, if any
 * @param exampleData example values used by the iteration, keyed by header
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IterationOutcome(
    int iteration,
    ScenarioStatus status,
    long durationMs,
    String error,
    String stackTrace,
    Map<String, String> exampleData
) implements Serializable {

    public IterationOutcome {
        exampleData = ResultData.testData(exampleData);
    }
}
