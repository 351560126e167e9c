package com.fleetrun.worker.local;

import com.fleetrun.core.data.DataProvider;
import com.fleetrun.core.engine.RunOptions;
import com.fleetrun.core.engine.RunProperties;
import com.fleetrun.core.engine.Supervisor;
import com.fleetrun.core.events.EventBus;
import com.fleetrun.core.expand.WorkItemExpander;
import com.fleetrun.core.metrics.FleetrunMetrics;
import com.fleetrun.core.model.RunReport;
import com.fleetrun.core.model.Scenario;
import com.fleetrun.core.model.ScenarioStatus;
import com.fleetrun.core.model.Step;
import com.fleetrun.core.publish.PublishRequest;
import com.fleetrun.worker.WorkerChannel;
import com.fleetrun.worker.WorkerChannelException;
import com.fleetrun.worker.WorkerProperties;
import com.fleetrun.worker.WorkerSpec;
import com.fleetrun.worker.protocol.WorkerMessage;
import com.fleetrun.worker.runtime.DryRunScenarioExecutor;
import com.fleetrun.worker.runtime.ScenarioExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.fleetrun.FeatureFixtures.feature;
import static com.fleetrun.FeatureFixtures.outline;
import static com.fleetrun.FeatureFixtures.plain;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class InProcessWorkerChannelTest {

    @Nested
    @DisplayName("channel")
    class Channel {

        @Test
        @DisplayName("says ready on start, answers execute, exits on terminate")
        void lifecycle() throws InterruptedException {
            var closed = new AtomicBoolean();
            ScenarioExecutor executor = new DryRunScenarioExecutor() {
                @Override
                public void close() {
                    closed.set(true);
                }
            };
            WorkerChannel channel = new InProcessWorkerChannelFactory(() -> executor)
                    .spawn(new WorkerSpec(2, "run-1", Map.of()));
            var messages = new CopyOnWriteArrayList<WorkerMessage>();
            var gotResult = new CountDownLatch(1);
            var exited = new CountDownLatch(1);
            channel.onMessage(message -> {
                messages.add(message);
                if (message instanceof WorkerMessage.Result) {
                    gotResult.countDown();
                }
            });
            channel.onExit(exited::countDown);
            channel.start();

            var f = feature("F", plain("a"));
            channel.send(new WorkerMessage.Execute("work-1", f, f.scenarios().get(0), Map.of(), null, null, null, null));
            assertTrue(gotResult.await(5, TimeUnit.SECONDS));
            channel.send(new WorkerMessage.Terminate());

            assertTrue(exited.await(5, TimeUnit.SECONDS));
            assertTrue(channel.awaitExit(Duration.ofSeconds(1)));
            assertFalse(channel.isConnected());
            assertTrue(closed.get());
            assertEquals(new WorkerMessage.Ready(2), messages.get(0));
            assertEquals("work-1", ((WorkerMessage.Result) messages.get(1)).scenarioId());
            assertThrows(WorkerChannelException.class, () -> channel.send(new WorkerMessage.Terminate()));
        }

        @Test
        @DisplayName("kill interrupts an idle worker and reports the exit")
        void kill() throws InterruptedException {
            WorkerChannel channel = new InProcessWorkerChannelFactory(DryRunScenarioExecutor::new)
                    .spawn(new WorkerSpec(1, "run-1", Map.of()));
            var exited = new CountDownLatch(1);
            channel.onExit(exited::countDown);
            channel.start();

            channel.kill();

            assertTrue(exited.await(5, TimeUnit.SECONDS));
            assertFalse(channel.isConnected());
        }
    }

    @Test
    @DisplayName("a full run on in-process dry-run workers consolidates outlines and reports failures")
    void fullRun() {
        var published = new CopyOnWriteArrayList<PublishRequest>();
        var factory = new InProcessWorkerChannelFactory(DryRunScenarioExecutor::new);
        var supervisor = new Supervisor(new WorkItemExpander(mock(DataProvider.class)), List.of(factory),
                published::add, new EventBus(), new FleetrunMetrics(new SimpleMeterRegistry()),
                new WorkerProperties(), new RunProperties());
        var failing = new Scenario("refund", List.of("@dry-run-fail"),
                List.of(new Step("Then", "the refund is issued")), null, null);
        var options = new RunOptions(3, "in-process", Duration.ofSeconds(5), Duration.ofSeconds(30),
                Duration.ofMillis(20), Duration.ofSeconds(2), Map.of(), Map.of(), 1000, 120);

        RunReport report = supervisor.run(List.of(
                feature("Shop", plain("browse"), outline("login as <user>", 4), failing)), options);

        assertEquals(6, report.totalItems());
        assertEquals(6, report.completedItems());
        assertEquals(3, report.workersStarted());
        assertFalse(report.timedOut());
        assertEquals(1, report.countByStatus(ScenarioStatus.FAILED));
        assertEquals(3, published.size());
        var consolidated = published.stream().filter(PublishRequest::isConsolidated).findFirst().orElseThrow();
        assertEquals("login as <user>", consolidated.scenarioName());
        assertEquals(ScenarioStatus.PASSED, consolidated.status());
        assertEquals(4, consolidated.iterationData().size());
        var refund = published.stream().filter(p -> p.scenarioName().equals("refund")).findFirst().orElseThrow();
        assertEquals("Dry run failure at: Then the refund is issued", refund.error());
        assertTrue(report.results().values().stream()
                .anyMatch(r -> "login as user-3 [Iteration 3/4]".equals(r.scenarioName())));
    }
}
