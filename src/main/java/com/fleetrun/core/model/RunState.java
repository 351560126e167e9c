package com.fleetrun.core.model;

/**
 * Lifecycle of a single orchestrated run.
 */
public enum RunState {
    BUILDING,
    SPAWNING,
    DISPATCHING,
    DRAINING,
    TERMINATING,
    DONE
}
