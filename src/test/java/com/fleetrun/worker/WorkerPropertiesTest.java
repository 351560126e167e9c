package com.fleetrun.worker;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class WorkerPropertiesTest {

    @Test
    void defaultsAreReasonable() {
        var props = new WorkerProperties();
        assertEquals("process", props.getProvider());
        assertEquals(0, props.getMaxWorkers());
        assertEquals(Duration.ofSeconds(30), props.getSpawnTimeout());
        assertTrue(props.getCommand().isEmpty());
        assertTrue(props.getEnvironment().isEmpty());
    }
}
