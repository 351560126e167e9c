package com.fleetrun.worker;

/**
 * Thrown when a message cannot be delivered to a worker.
 */
public class WorkerChannelException extends RuntimeException {

    public WorkerChannelException(String message) {
        super(message);
    }

    public WorkerChannelException(String message, Throwable cause) {
        super(message, cause);
    }
}
