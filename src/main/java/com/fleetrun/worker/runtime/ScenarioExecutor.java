package com.fleetrun.worker.runtime;

/**
 * Runs one scenario inside a worker. Implementations are discovered with
 * {@link java.util.ServiceLoader}; see {@link ScenarioExecutors}.
 *
 * <p>An executor is used by one worker thread at a time and sees one request at a time.
 */
public interface ScenarioExecutor {

    /**
     * Executes the scenario. A thrown exception is reported as a failed result.
     */
    ExecutionOutcome execute(ExecutionRequest request) throws Exception;

    /**
     * Releases whatever the executor holds. Called once when the worker terminates.
     */
    default void close() {
    }
}
