package com.fleetrun.worker.protocol;

/**
 * Thrown when a line on a worker channel cannot be encoded or decoded.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
