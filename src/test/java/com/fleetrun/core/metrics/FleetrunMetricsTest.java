package com.fleetrun.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FleetrunMetricsTest {

    private SimpleMeterRegistry registry;
    private FleetrunMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new FleetrunMetrics(registry);
    }

    @Test
    @DisplayName("recordWorkerSpawn counts by handshake result")
    void recordWorkerSpawn() {
        metrics.recordWorkerSpawn(true);
        metrics.recordWorkerSpawn(true);
        metrics.recordWorkerSpawn(false);

        var ready = registry.find("fleetrun.workers.spawned").tag("result", "ready").counter();
        var failed = registry.find("fleetrun.workers.spawned").tag("result", "failed").counter();

        assertNotNull(ready);
        assertNotNull(failed);
        assertEquals(2.0, ready.count());
        assertEquals(1.0, failed.count());
    }

    @Test
    @DisplayName("recordCompletion counts and times by status")
    void recordCompletion() {
        metrics.recordCompletion("passed", 200);
        metrics.recordCompletion("failed", 100);

        var timer = registry.find("fleetrun.item.duration").tag("status", "passed").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertEquals(1.0, registry.find("fleetrun.items.completed").tag("status", "failed").counter().count());
    }

    @Test
    @DisplayName("recordPublish tags single and consolidated")
    void recordPublish() {
        metrics.recordPublish("single");
        metrics.recordPublish("consolidated");
        metrics.recordPublish("consolidated");

        assertEquals(2.0, registry.find("fleetrun.scenarios.published").tag("kind", "consolidated").counter().count());
    }

    @Test
    @DisplayName("recordOpenBuckets records a distribution sample")
    void recordOpenBuckets() {
        metrics.recordOpenBuckets(2);

        var summary = registry.find("fleetrun.aggregation.open_buckets").summary();
        assertNotNull(summary);
        assertEquals(2.0, summary.totalAmount());
    }

    @Test
    @DisplayName("recordRun creates a timer tagged with timeout")
    void recordRun() {
        metrics.recordRun(1500, true);

        var timer = registry.find("fleetrun.run.duration").tag("timedOut", "true").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("dispatch and disconnect counters increment")
    void counters() {
        metrics.recordDispatch();
        metrics.recordDispatch();
        metrics.recordDisconnect();

        assertEquals(2.0, registry.find("fleetrun.items.dispatched").counter().count());
        assertEquals(1.0, registry.find("fleetrun.workers.disconnects").counter().count());
    }
}
