package com.fleetrun.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for orchestrated runs.
 */
@Service
public class FleetrunMetrics {

    private final MeterRegistry registry;

    public FleetrunMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordWorkerSpawn(boolean ready) {
        Counter.builder("fleetrun.workers.spawned")
                .description("Worker spawn attempts by handshake result")
                .tag("result", ready ? "ready" : "failed")
                .register(registry)
                .increment();
    }

    public void recordDispatch() {
        Counter.builder("fleetrun.items.dispatched")
                .description("Execute messages sent to workers")
                .register(registry)
                .increment();
    }

    public void recordCompletion(String status, long durationMs) {
        Counter.builder("fleetrun.items.completed")
                .tag("status", status)
                .register(registry)
                .increment();
        Timer.builder("fleetrun.item.duration")
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    public void recordDisconnect() {
        Counter.builder("fleetrun.workers.disconnects")
                .description("Workers observed disconnected while holding work")
                .register(registry)
                .increment();
    }

    /**
     * @param kind "single" for plain scenarios, "consolidated" for data-driven ones
     */
    public void recordPublish(String kind) {
        Counter.builder("fleetrun.scenarios.published")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordOpenBuckets(int count) {
        DistributionSummary.builder("fleetrun.aggregation.open_buckets")
                .description("Aggregation buckets still open at shutdown")
                .register(registry)
                .record(count);
    }

    public void recordRun(long ms, boolean timedOut) {
        Timer.builder("fleetrun.run.duration")
                .tag("timedOut", String.valueOf(timedOut))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
