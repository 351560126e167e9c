package com.fleetrun.core.data;

/**
 * Thrown when external example data cannot be read or parsed.
 */
public class DataSourceException extends RuntimeException {

    public DataSourceException(String message) {
        super(message);
    }

    public DataSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
