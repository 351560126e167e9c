package com.fleetrun.core.engine;

import com.fleetrun.core.events.EventBus;
import com.fleetrun.core.logging.MdcContext;
import com.fleetrun.core.metrics.FleetrunMetrics;
import com.fleetrun.core.model.ScenarioResult;
import com.fleetrun.core.model.ScenarioStatus;
import com.fleetrun.core.model.WorkItem;
import com.fleetrun.core.publish.PublishRequest;
import com.fleetrun.core.publish.ResultPublisher;
import com.fleetrun.worker.Worker;
import com.fleetrun.worker.protocol.WorkerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns worker messages into recorded results.
 *
 * <p>On {@code result} the collector records the outcome against the worker's
 * current item, sends it to the aggregator (iterations) or straight to the publisher
 * (plain scenarios), frees the worker and re-enters the dispatcher. A worker that
 * goes away while holding an item produces a degraded {@code FAILED} result that
 * takes the same path, so aggregation buckets still complete.
 *
 * <p>Coordinator-confined.
 */
public class ResultCollector {

    private static final Logger log = LoggerFactory.getLogger(ResultCollector.class);

    private final RunContext context;
    private final Dispatcher dispatcher;
    private final IterationAggregator aggregator;
    private final ResultPublisher publisher;
    private final EventBus eventBus;
    private final FleetrunMetrics metrics;

    public ResultCollector(RunContext context, Dispatcher dispatcher, IterationAggregator aggregator,
                           ResultPublisher publisher, EventBus eventBus, FleetrunMetrics metrics) {
        this.context = context;
        this.dispatcher = dispatcher;
        this.aggregator = aggregator;
        this.publisher = publisher;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public void handle(Worker worker, WorkerMessage message) {
        WorkItem current = worker.currentWork();
        if (current != null) {
            MdcContext.setWorkItem(context.runId(), worker.id(), current.id());
        } else {
            MdcContext.setWorker(context.runId(), worker.id());
        }
        try {
            if (message instanceof WorkerMessage.Result result) {
                try {
                    onResult(worker, result);
                } catch (RuntimeException e) {
                    recover(worker, e);
                }
            } else if (message instanceof WorkerMessage.Error error) {
                log.error("Worker {} error: {}", worker.id(), error.error());
            } else if (message instanceof WorkerMessage.Log entry) {
                log.debug("Worker {}: {}", worker.id(), entry.message());
            } else if (message instanceof WorkerMessage.Ready) {
                log.debug("Worker {} sent ready again", worker.id());
            } else {
                log.warn("Worker {} sent unexpected {}", worker.id(), message.getClass().getSimpleName());
            }
        } finally {
            MdcContext.clearWorkItem();
        }
    }

    /**
     * Called when a worker's channel has closed.
     */
    public void onDisconnect(Worker worker) {
        worker.markLost();
        WorkItem item = worker.currentWork();
        if (item == null) {
            log.debug("Worker {} exited while idle", worker.id());
            return;
        }

        metrics.recordDisconnect();
        String reason = "Worker " + worker.id() + " disconnected while executing " + item.id();
        log.error(reason);
        eventBus.emit("worker.disconnected", context.runId(), item.id(),
                Map.of("workerId", worker.id()));
        complete(worker, item, ScenarioResult.degraded(item, worker.id(), ScenarioStatus.FAILED, reason));
    }

    /**
     * Records every item that will not get a result: in-flight items become
     * degraded {@code FAILED}, queued items degraded {@code SKIPPED}. Nothing is
     * published for them and the completed count is left alone.
     */
    public void abandonOutstanding(Collection<Worker> workers, String reason) {
        for (var worker : workers) {
            if (!worker.isBusy()) {
                continue;
            }
            WorkItem item = worker.release();
            worker.markLost();
            log.warn("Abandoning {} on worker {}: {}", item.id(), worker.id(), reason);
            context.record(ScenarioResult.degraded(item, worker.id(), ScenarioStatus.FAILED,
                    reason + " while executing " + item.id() + " on worker " + worker.id()));
        }
        for (var item : dispatcher.drainPending()) {
            context.record(ScenarioResult.degraded(item, null, ScenarioStatus.SKIPPED, "Not dispatched: " + reason));
        }
    }

    private void onResult(Worker worker, WorkerMessage.Result message) {
        WorkItem item = worker.currentWork();
        if (item == null) {
            log.warn("Worker {} sent a result for {} with no current work, dropping it",
                    worker.id(), message.scenarioId());
            return;
        }
        if (message.scenarioId() != null && !message.scenarioId().equals(item.id())) {
            log.warn("Worker {} reported {} but holds {}, recording against {}",
                    worker.id(), message.scenarioId(), item.id(), item.id());
        }

        ScenarioStatus status = message.status();
        if (status == null) {
            log.warn("Worker {} sent a result without status for {}, treating it as failed", worker.id(), item.id());
            status = ScenarioStatus.FAILED;
        }
        var result = new ScenarioResult(item.id(),
                message.name() != null ? message.name() : item.scenarioName(),
                item.featureName(), worker.id(), status, message.duration(), message.error(),
                message.stackTrace(), message.artifacts(), message.testData(), item.iterationNumber(), false);
        complete(worker, item, result);
    }

    /**
     * A result that could not be processed still ends its {@code execute}: the
     * item is completed as a degraded {@code FAILED} and the worker is freed.
     */
    private void recover(Worker worker, RuntimeException e) {
        WorkItem item = worker.currentWork();
        if (item == null) {
            log.error("Worker {} sent a result that could not be processed: {}", worker.id(), e.getMessage(), e);
            return;
        }
        String reason = "Result from worker " + worker.id() + " for " + item.id()
                + " could not be processed: " + e.getMessage();
        log.error(reason, e);
        complete(worker, item, ScenarioResult.degraded(item, worker.id(), ScenarioStatus.FAILED, reason));
    }

    private void complete(Worker worker, WorkItem item, ScenarioResult result) {
        if (!context.record(result)) {
            log.warn("{} already has a result, ignoring the one from worker {}", item.id(), worker.id());
            worker.release();
            dispatcher.assignNext(worker);
            return;
        }

        try {
            if (item.isIteration()) {
                aggregator.accept(item, result).ifPresent(request -> publish(request, "consolidated"));
            } else {
                publish(PublishRequest.single(item, result), "single");
            }
        } catch (RuntimeException e) {
            log.error("Could not route the result of {}: {}", item.id(), e.getMessage(), e);
        }

        int completed = context.incrementCompleted();
        log.info("[{}/{}] {} {} ({}ms)", completed, context.totalItems(),
                result.status() == ScenarioStatus.PASSED ? "✓" : "✗",
                result.scenarioName(), result.durationMs());
        metrics.recordCompletion(result.status().label(), result.durationMs());

        var payload = new LinkedHashMap<String, Object>();
        payload.put("status", result.status().label());
        payload.put("durationMs", result.durationMs());
        payload.put("completed", completed);
        payload.put("total", context.totalItems());
        payload.put("degraded", result.degraded());
        if (result.workerId() != null) {
            payload.put("workerId", result.workerId());
        }
        eventBus.emit("item.completed", context.runId(), item.id(), payload);

        worker.release();
        dispatcher.assignNext(worker);
    }

    private void publish(PublishRequest request, String kind) {
        try {
            publisher.publish(request);
        } catch (RuntimeException e) {
            log.error("Publisher failed for '{}': {}", request.scenarioName(), e.getMessage(), e);
        }
        context.incrementPublished();
        metrics.recordPublish(kind);
        eventBus.emit("scenario.published", context.runId(), null,
                Map.of("scenario", request.scenarioName(), "status", request.status().label(), "kind", kind));
    }
}
