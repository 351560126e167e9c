package com.fleetrun.worker;

/**
 * Creates worker channels for one isolation strategy.
 * Implementations: {@code ProcessWorkerChannelFactory} ("process"),
 * {@code InProcessWorkerChannelFactory} ("in-process").
 */
public interface WorkerChannelFactory {

    /**
     * Name used to select this factory via {@code fleetrun.worker.provider}.
     */
    String provider();

    /**
     * Starts a worker. Returns as soon as the unit is running; readiness is
     * signalled later by a {@code ready} message, delivered once the caller has
     * registered its handlers and called {@link WorkerChannel#start()}.
     *
     * @throws WorkerSpawnException if the unit cannot be started
     */
    WorkerChannel spawn(WorkerSpec spec);
}
