package com.fleetrun.core.engine;

import com.fleetrun.core.events.EventBus;
import com.fleetrun.core.metrics.FleetrunMetrics;
import com.fleetrun.core.model.WorkItem;
import com.fleetrun.worker.Worker;
import com.fleetrun.worker.WorkerChannelException;
import com.fleetrun.worker.protocol.WorkerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Owns the pending-work queue and hands items to idle workers, first in, first out.
 *
 * <p>Coordinator-confined. An item whose {@code execute} cannot be delivered goes
 * back to the head of the queue and the worker is taken out of rotation, so no
 * item is ever sent twice.
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final String runId;
    private final Deque<WorkItem> queue = new ArrayDeque<>();
    private final Map<String, String> config;
    private final EventBus eventBus;
    private final FleetrunMetrics metrics;
    private int dispatched;

    public Dispatcher(String runId, Map<String, String> config, EventBus eventBus, FleetrunMetrics metrics) {
        this.runId = runId;
        this.config = config;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public void enqueue(List<WorkItem> items) {
        queue.addAll(items);
    }

    /**
     * Gives the head of the queue to {@code worker} if it is idle.
     *
     * @return true if an item was sent
     */
    public boolean assignNext(Worker worker) {
        if (!worker.isAvailable() || queue.isEmpty()) {
            return false;
        }
        WorkItem item = queue.poll();
        worker.assign(item);
        try {
            worker.channel().send(toExecute(item));
        } catch (WorkerChannelException e) {
            log.warn("Could not send {} to worker {}, requeueing: {}", item.id(), worker.id(), e.getMessage());
            worker.release();
            worker.markLost();
            queue.addFirst(item);
            return false;
        }
        dispatched++;
        metrics.recordDispatch();
        eventBus.emit("item.dispatched", runId, item.id(),
                Map.of("workerId", worker.id(), "scenario", item.scenarioName()));
        log.debug("Dispatched {} '{}' to worker {}", item.id(), item.scenarioName(), worker.id());
        return true;
    }

    /**
     * One assignment pass over {@code workers}.
     */
    public int dispatchAll(Collection<Worker> workers) {
        int sent = 0;
        for (var worker : workers) {
            if (assignNext(worker)) {
                sent++;
            }
        }
        return sent;
    }

    public int pending() {
        return queue.size();
    }

    public int dispatched() {
        return dispatched;
    }

    /**
     * Empties the queue, returning whatever was never dispatched.
     */
    public List<WorkItem> drainPending() {
        var remaining = new ArrayList<>(queue);
        queue.clear();
        return remaining;
    }

    private WorkerMessage.Execute toExecute(WorkItem item) {
        return new WorkerMessage.Execute(item.id(), item.feature(), item.scenario(), config,
                item.exampleRow(), item.exampleHeaders(), item.iterationNumber(), item.totalIterations());
    }
}
