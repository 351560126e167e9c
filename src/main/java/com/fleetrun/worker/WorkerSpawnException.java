package com.fleetrun.worker;

/**
 * Thrown when a worker cannot be started.
 */
public class WorkerSpawnException extends RuntimeException {

    public WorkerSpawnException(String message) {
        super(message);
    }

    public WorkerSpawnException(String message, Throwable cause) {
        super(message, cause);
    }
}
