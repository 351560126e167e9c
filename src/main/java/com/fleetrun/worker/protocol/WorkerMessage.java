package com.fleetrun.worker.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fleetrun.core.model.Feature;
import com.fleetrun.core.model.Scenario;
import com.fleetrun.core.model.ScenarioStatus;

import java.util.List;
import java.util.Map;

/**
 * Messages exchanged between the coordinator and a worker, one record per kind.
 * On the wire each message is a JSON object with a {@code type} discriminator.
 *
 * <pre>
 *   worker      -> coordinator : ready (once), result (once per execute), error, log
 *   coordinator -> worker      : execute, terminate
 * </pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = WorkerMessage.Ready.class, name = "ready"),
        @JsonSubTypes.Type(value = WorkerMessage.Execute.class, name = "execute"),
        @JsonSubTypes.Type(value = WorkerMessage.Result.class, name = "result"),
        @JsonSubTypes.Type(value = WorkerMessage.Error.class, name = "error"),
        @JsonSubTypes.Type(value = WorkerMessage.Log.class, name = "log"),
        @JsonSubTypes.Type(value = WorkerMessage.Terminate.class, name = "terminate")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface WorkerMessage {

    /** Sent once by a worker after it has initialized. */
    record Ready(Integer workerId) implements WorkerMessage {}

    /** Assigns one work item to a worker. */
    record Execute(
        String scenarioId,
        Feature feature,
        Scenario scenario,
        Map<String, String> config,
        List<String> exampleRow,
        List<String> exampleHeaders,
        Integer iterationNumber,
        Integer totalIterations
    ) implements WorkerMessage {}

    /** Terminal report for the last {@link Execute}. */
    record Result(
        String scenarioId,
        String name,
        ScenarioStatus status,
        long duration,
        String error,
        String stackTrace,
        Map<String, List<String>> artifacts,
        Map<String, String> testData
    ) implements WorkerMessage {

        public static Result of(String scenarioId, ScenarioStatus status, long duration) {
            return new Result(scenarioId, null, status, duration, null, null, null, null);
        }

        public static Result failed(String scenarioId, long duration, String error, String stackTrace) {
            return new Result(scenarioId, null, ScenarioStatus.FAILED, duration, error, stackTrace, null, null);
        }
    }

    /** Non-terminal diagnostic; the worker keeps its assignment. */
    record Error(String error) implements WorkerMessage {}

    /** Non-terminal diagnostic log line. */
    record Log(String message) implements WorkerMessage {}

    /** Asks a worker to clean up and exit. */
    record Terminate() implements WorkerMessage {}
}
