package com.fleetrun.cli;

/**
 * Thrown when a features file cannot be read or parsed.
 */
public class FeatureLoadException extends RuntimeException {

    public FeatureLoadException(String message) {
        super(message);
    }

    public FeatureLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
