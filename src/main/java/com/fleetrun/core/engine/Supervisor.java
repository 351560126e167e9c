package com.fleetrun.core.engine;

import com.fleetrun.core.events.EventBus;
import com.fleetrun.core.expand.WorkItemExpander;
import com.fleetrun.core.logging.MdcContext;
import com.fleetrun.core.metrics.FleetrunMetrics;
import com.fleetrun.core.model.Feature;
import com.fleetrun.core.model.RunReport;
import com.fleetrun.core.model.RunState;
import com.fleetrun.core.model.ScenarioKey;
import com.fleetrun.core.model.ScenarioStatus;
import com.fleetrun.core.model.WorkItem;
import com.fleetrun.core.publish.ResultPublisher;
import com.fleetrun.worker.Worker;
import com.fleetrun.worker.WorkerChannelFactory;
import com.fleetrun.worker.WorkerCounts;
import com.fleetrun.worker.WorkerPool;
import com.fleetrun.worker.WorkerProperties;
import com.fleetrun.worker.protocol.WorkerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Drives one run from features to a {@link RunReport}:
 * {@code BUILDING -> SPAWNING -> DISPATCHING -> DRAINING -> TERMINATING -> DONE}.
 *
 * <p>Each run gets a single-threaded coordinator. Worker callbacks, dispatching,
 * result collection and aggregation all execute on it one task at a time, so the
 * run state needs no locking. The calling thread only waits: for handshakes, for
 * completion (polling), and for workers to exit.
 *
 * <p>The only failure this class raises is {@link RunStartException} when no worker
 * comes up. Everything else (spawn failures, disconnects, deadline) ends up in the report.
 */
@Service
public class Supervisor {

    private static final Logger log = LoggerFactory.getLogger(Supervisor.class);

    private final WorkItemExpander expander;
    private final Map<String, WorkerChannelFactory> factories = new LinkedHashMap<>();
    private final ResultPublisher publisher;
    private final EventBus eventBus;
    private final FleetrunMetrics metrics;
    private final WorkerProperties workerProperties;
    private final RunProperties runProperties;

    public Supervisor(WorkItemExpander expander, List<WorkerChannelFactory> factories, ResultPublisher publisher,
                      EventBus eventBus, FleetrunMetrics metrics,
                      WorkerProperties workerProperties, RunProperties runProperties) {
        this.expander = expander;
        for (var factory : factories) {
            this.factories.put(factory.provider(), factory);
        }
        this.publisher = publisher;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.workerProperties = workerProperties;
        this.runProperties = runProperties;
    }

    public RunReport run(List<Feature> features) {
        return run(features, RunOptions.from(workerProperties, runProperties));
    }

    public RunReport run(List<Feature> features, RunOptions options) {
        String runId = "run-" + UUID.randomUUID().toString().substring(0, 8);
        MdcContext.setRun(runId);
        try {
            return execute(runId, features, options);
        } finally {
            eventBus.closeRun(runId);
            MdcContext.clear();
        }
    }

    private RunReport execute(String runId, List<Feature> features, RunOptions options) {
        WorkerChannelFactory factory = factories.get(options.provider());
        if (factory == null) {
            throw new IllegalArgumentException("Unknown worker provider '" + options.provider()
                    + "', expected one of " + factories.keySet());
        }

        List<WorkItem> items = expander.expand(features);
        var context = new RunContext(runId, items.size());
        if (items.isEmpty()) {
            log.info("Run {} has no work items", runId);
            context.state(RunState.DONE);
            eventBus.emit("run.completed", runId, null, Map.of("total", 0));
            return RunReport.empty(runId);
        }

        int poolSize = WorkerCounts.poolSize(options.maxWorkers(), items.size());
        log.info("Run {}: {} work items, {} workers ({})", runId, items.size(), poolSize, factory.provider());
        eventBus.emit("run.started", runId, null,
                Map.of("total", items.size(), "workers", poolSize));

        var aggregator = new IterationAggregator(options.summaryMaxChars(), options.shortErrorMaxChars());
        var dispatcher = new Dispatcher(runId, options.config(), eventBus, metrics);
        var collector = new ResultCollector(context, dispatcher, aggregator, publisher, eventBus, metrics);
        dispatcher.enqueue(items);

        ExecutorService coordinator = Executors.newSingleThreadExecutor(r -> {
            var thread = new Thread(r, "fleetrun-coordinator-" + runId);
            thread.setDaemon(true);
            return thread;
        });
        var pool = new WorkerPool(factory, runId, options.workerEnvironment(), options.spawnTimeout(),
                eventBus, metrics);

        try {
            context.state(RunState.SPAWNING);
            List<Worker> ready = pool.start(poolSize, new WorkerPool.Listener() {
                @Override
                public void onMessage(Worker worker, WorkerMessage message) {
                    post(coordinator, runId, () -> collector.handle(worker, message));
                }

                @Override
                public void onDisconnect(Worker worker) {
                    post(coordinator, runId, () -> collector.onDisconnect(worker));
                }
            });
            if (ready.isEmpty()) {
                context.state(RunState.DONE);
                throw new RunStartException("No worker became ready out of " + poolSize + " started for run " + runId);
            }
            context.workersStarted(ready.size());

            context.state(RunState.DISPATCHING);
            int sent = onCoordinator(coordinator, runId, () -> dispatcher.dispatchAll(pool.workers()));
            log.debug("Initial dispatch sent {} items", sent);

            context.state(RunState.DRAINING);
            Drain outcome = drain(coordinator, runId, options, context, dispatcher, pool);
            if (outcome != Drain.COMPLETE) {
                String reason = outcome == Drain.TIMED_OUT ? "run deadline exceeded" : "no workers left";
                onCoordinator(coordinator, runId, () -> {
                    collector.abandonOutstanding(pool.workers(), reason);
                    return null;
                });
            }

            List<ScenarioKey> unflushed = onCoordinator(coordinator, runId, () -> reportOpenBuckets(aggregator));

            context.state(RunState.TERMINATING);
            pool.terminateAll(options.terminationGrace());

            RunReport report = onCoordinator(coordinator, runId, () -> context.toReport(unflushed));
            context.state(RunState.DONE);
            finish(report);
            return report;
        } finally {
            if (context.state() != RunState.DONE) {
                pool.terminateAll(options.terminationGrace());
            }
            coordinator.shutdown();
        }
    }

    private enum Drain { COMPLETE, TIMED_OUT, STARVED }

    private Drain drain(ExecutorService coordinator, String runId, RunOptions options, RunContext context,
                        Dispatcher dispatcher, WorkerPool pool) {
        long deadline = System.nanoTime() + options.deadline().toNanos();
        while (true) {
            Drain status = onCoordinator(coordinator, runId, () -> {
                if (context.isComplete()) {
                    return Drain.COMPLETE;
                }
                dispatcher.dispatchAll(pool.workers());
                if (pool.liveWorkers().isEmpty()) {
                    return Drain.STARVED;
                }
                return null;
            });
            if (status != null) {
                if (status == Drain.STARVED) {
                    log.error("All workers are gone with {} of {} items unfinished",
                            context.totalItems() - context.completed(), context.totalItems());
                }
                return status;
            }
            if (System.nanoTime() >= deadline) {
                onCoordinator(coordinator, runId, () -> {
                    context.markTimedOut();
                    return null;
                });
                log.error("Run {} exceeded its {}s deadline", runId, options.deadline().toSeconds());
                eventBus.emit("run.timed_out", runId, null,
                        Map.of("deadlineSeconds", options.deadline().toSeconds()));
                return Drain.TIMED_OUT;
            }
            try {
                Thread.sleep(options.pollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Run {} interrupted while draining", runId);
                return Drain.TIMED_OUT;
            }
        }
    }

    private List<ScenarioKey> reportOpenBuckets(IterationAggregator aggregator) {
        var open = aggregator.openBuckets();
        var keys = new ArrayList<ScenarioKey>(open.size());
        for (var bucket : open) {
            log.warn("Consolidated result for '{}' was never published: {}/{} iterations, missing {}",
                    bucket.key(), bucket.received(), bucket.total(), bucket.missing());
            keys.add(bucket.key());
        }
        metrics.recordOpenBuckets(open.size());
        return keys;
    }

    private void finish(RunReport report) {
        metrics.recordRun(report.elapsedMs(), report.timedOut());
        log.info("Run {} done in {}ms: {} passed, {} failed, {} skipped, {} degraded, {} published",
                report.runId(), report.elapsedMs(),
                report.countByStatus(ScenarioStatus.PASSED), report.countByStatus(ScenarioStatus.FAILED),
                report.countByStatus(ScenarioStatus.SKIPPED), report.degradedCount(), report.publishedCount());
        var payload = new LinkedHashMap<String, Object>();
        payload.put("total", report.totalItems());
        payload.put("completed", report.completedItems());
        payload.put("failed", report.countByStatus(ScenarioStatus.FAILED));
        payload.put("timedOut", report.timedOut());
        eventBus.emit("run.completed", report.runId(), null, payload);
    }

    private static void post(ExecutorService coordinator, String runId, Runnable task) {
        try {
            coordinator.execute(() -> {
                MdcContext.setRun(runId);
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Coordinator task failed: {}", e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Run {} is over, dropping late worker callback", runId);
        }
    }

    private static <T> T onCoordinator(ExecutorService coordinator, String runId, Callable<T> task) {
        try {
            return coordinator.submit(() -> {
                MdcContext.setRun(runId);
                return task.call();
            }).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting on coordinator for run " + runId, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Coordinator task failed for run " + runId, e.getCause());
        }
    }
}
