package com.fleetrun;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FleetrunApplicationTest {

    @Test
    @DisplayName("a leading 'worker' argument selects worker mode")
    void workerMode() {
        assertTrue(FleetrunApplication.isWorkerMode(new String[]{"worker"}));
        assertTrue(FleetrunApplication.isWorkerMode(new String[]{"worker", "--ignored"}));
    }

    @Test
    @DisplayName("CLI invocations start the application")
    void cliMode() {
        assertFalse(FleetrunApplication.isWorkerMode(new String[]{}));
        assertFalse(FleetrunApplication.isWorkerMode(new String[]{"run", "features.json"}));
        assertFalse(FleetrunApplication.isWorkerMode(new String[]{"run", "worker"}));
    }
}
