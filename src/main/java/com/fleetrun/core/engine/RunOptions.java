package com.fleetrun.core.engine;

import com.fleetrun.worker.WorkerCounts;
import com.fleetrun.worker.WorkerProperties;

import java.time.Duration;
import java.util.Map;

/**
 * Settings for one {@link Supervisor#run} call, resolved from configuration and
 * optionally overridden by the caller.
 *
 * @param maxWorkers        upper bound on workers; the pool never exceeds the item count
 * @param provider          worker channel factory to use ("process" or "in-process")
 * @param spawnTimeout      how long every worker has to send {@code ready}
 * @param deadline          global wall-clock limit for draining
 * @param pollInterval      how often the supervisor checks for completion
 * @param terminationGrace  how long workers get to exit before being killed
 * @param config            snapshot sent to workers with every execute
 * @param workerEnvironment extra environment variables for spawned workers
 * @param summaryMaxChars   bound on the consolidated summary text
 * @param shortErrorMaxChars bound on each per-iteration error in the summary
 */
public record RunOptions(
    int maxWorkers,
    String provider,
    Duration spawnTimeout,
    Duration deadline,
    Duration pollInterval,
    Duration terminationGrace,
    Map<String, String> config,
    Map<String, String> workerEnvironment,
    int summaryMaxChars,
    int shortErrorMaxChars
) {

    public RunOptions {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1, got " + maxWorkers);
        }
        config = config != null ? Map.copyOf(config) : Map.of();
        workerEnvironment = workerEnvironment != null ? Map.copyOf(workerEnvironment) : Map.of();
    }

    /**
     * Builds options from configuration. The worker count honours {@code PARALLEL_WORKERS}.
     */
    public static RunOptions from(WorkerProperties workers, RunProperties run) {
        int max = WorkerCounts.resolve(null, System.getenv(), workers.getMaxWorkers(),
                Runtime.getRuntime().availableProcessors());
        return new RunOptions(max, workers.getProvider(), workers.getSpawnTimeout(), run.getDeadline(),
                run.getPollInterval(), run.getTerminationGrace(), run.getConfig(), workers.getEnvironment(),
                run.getSummaryMaxChars(), run.getShortErrorMaxChars());
    }

    public RunOptions withMaxWorkers(int value) {
        return new RunOptions(value, provider, spawnTimeout, deadline, pollInterval, terminationGrace,
                config, workerEnvironment, summaryMaxChars, shortErrorMaxChars);
    }

    public RunOptions withProvider(String value) {
        return new RunOptions(maxWorkers, value, spawnTimeout, deadline, pollInterval, terminationGrace,
                config, workerEnvironment, summaryMaxChars, shortErrorMaxChars);
    }

    public RunOptions withDeadline(Duration value) {
        return new RunOptions(maxWorkers, provider, spawnTimeout, value, pollInterval, terminationGrace,
                config, workerEnvironment, summaryMaxChars, shortErrorMaxChars);
    }

    public RunOptions withSpawnTimeout(Duration value) {
        return new RunOptions(maxWorkers, provider, value, deadline, pollInterval, terminationGrace,
                config, workerEnvironment, summaryMaxChars, shortErrorMaxChars);
    }
}
