package com.fleetrun.core.engine;

import com.fleetrun.core.data.DataProvider;
import com.fleetrun.core.events.EventBus;
import com.fleetrun.core.events.FleetrunEvent;
import com.fleetrun.core.expand.WorkItemExpander;
import com.fleetrun.core.metrics.FleetrunMetrics;
import com.fleetrun.core.model.WorkItem;
import com.fleetrun.worker.Worker;
import com.fleetrun.worker.WorkerChannel;
import com.fleetrun.worker.WorkerChannelException;
import com.fleetrun.worker.protocol.WorkerMessage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.fleetrun.FeatureFixtures.feature;
import static com.fleetrun.FeatureFixtures.outline;
import static com.fleetrun.FeatureFixtures.plain;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class DispatcherTest {

    private SimpleMeterRegistry registry;
    private List<FleetrunEvent> events;
    private Dispatcher dispatcher;
    private List<WorkItem> items;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        var eventBus = new EventBus();
        events = new ArrayList<>();
        eventBus.subscribeAll(events::add);
        dispatcher = new Dispatcher("run-1", Map.of("project", "demo"), eventBus, new FleetrunMetrics(registry));
        items = new WorkItemExpander(mock(DataProvider.class))
                .expand(List.of(feature("F", plain("a"), outline("o", 2), plain("b"))));
    }

    private static Worker worker(int id) {
        return new Worker(id, mock(WorkerChannel.class));
    }

    @Nested
    @DisplayName("assignNext")
    class AssignNext {

        @Test
        @DisplayName("sends the head of the queue with the run config")
        void sendsHead() {
            dispatcher.enqueue(items);
            var w = worker(1);

            assertTrue(dispatcher.assignNext(w));

            var captor = ArgumentCaptor.forClass(WorkerMessage.class);
            verify(w.channel()).send(captor.capture());
            var execute = (WorkerMessage.Execute) captor.getValue();
            assertEquals("work-1", execute.scenarioId());
            assertEquals(Map.of("project", "demo"), execute.config());
            assertNull(execute.iterationNumber());
            assertSame(items.get(0), w.currentWork());
            assertEquals(3, dispatcher.pending());
            assertEquals(1, dispatcher.dispatched());
            assertEquals(1.0, registry.counter("fleetrun.items.dispatched").count());
            assertEquals("item.dispatched", events.get(0).eventType());
            assertEquals("work-1", events.get(0).workItemId());
        }

        @Test
        @DisplayName("iteration items carry their example row")
        void iterationFields() {
            dispatcher.enqueue(items.subList(1, 2));
            var w = worker(1);

            dispatcher.assignNext(w);

            var captor = ArgumentCaptor.forClass(WorkerMessage.class);
            verify(w.channel()).send(captor.capture());
            var execute = (WorkerMessage.Execute) captor.getValue();
            assertEquals(1, execute.iterationNumber());
            assertEquals(2, execute.totalIterations());
            assertEquals(List.of("user"), execute.exampleHeaders());
            assertEquals(List.of("user-1"), execute.exampleRow());
        }

        @Test
        @DisplayName("busy and lost workers are skipped")
        void unavailableSkipped() {
            dispatcher.enqueue(items);
            var busy = worker(1);
            busy.assign(items.get(3));
            var lost = worker(2);
            lost.markLost();

            assertFalse(dispatcher.assignNext(busy));
            assertFalse(dispatcher.assignNext(lost));
            verifyNoInteractions(busy.channel(), lost.channel());
            assertEquals(4, dispatcher.pending());
        }

        @Test
        @DisplayName("empty queue sends nothing")
        void emptyQueue() {
            var w = worker(1);

            assertFalse(dispatcher.assignNext(w));
            assertFalse(w.isBusy());
        }

        @Test
        @DisplayName("a failed send requeues at the head and takes the worker out of rotation")
        void sendFailure() {
            dispatcher.enqueue(items);
            var broken = worker(1);
            doThrow(new WorkerChannelException("pipe closed")).when(broken.channel()).send(any());

            assertFalse(dispatcher.assignNext(broken));

            assertTrue(broken.isLost());
            assertFalse(broken.isBusy());
            assertEquals(4, dispatcher.pending());
            assertEquals(0, dispatcher.dispatched());
            assertTrue(events.isEmpty());

            var healthy = worker(2);
            dispatcher.assignNext(healthy);
            assertEquals("work-1", healthy.currentWork().id());
        }
    }

    @Test
    @DisplayName("dispatchAll fills every idle worker in FIFO order")
    void dispatchAll() {
        dispatcher.enqueue(items);
        var workers = List.of(worker(1), worker(2), worker(3));

        assertEquals(3, dispatcher.dispatchAll(workers));
        assertEquals(List.of("work-1", "work-2", "work-3"),
                workers.stream().map(w -> w.currentWork().id()).toList());
        assertEquals(0, dispatcher.dispatchAll(workers));
        assertEquals(1, dispatcher.pending());
    }

    @Test
    @DisplayName("drainPending empties the queue")
    void drainPending() {
        dispatcher.enqueue(items);

        assertEquals(items, dispatcher.drainPending());
        assertEquals(0, dispatcher.pending());
        assertTrue(dispatcher.drainPending().isEmpty());
    }
}
