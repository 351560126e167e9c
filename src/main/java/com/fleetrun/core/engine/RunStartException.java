package com.fleetrun.core.engine;

/**
 * Thrown when a run cannot start because no worker completed its handshake.
 * This is the only failure {@link Supervisor#run} raises; partial failures are
 * reported in the {@link com.fleetrun.core.model.RunReport}.
 */
public class RunStartException extends RuntimeException {

    public RunStartException(String message) {
        super(message);
    }
}
