package com.fleetrun.worker;

import com.fleetrun.core.events.EventBus;
import com.fleetrun.core.metrics.FleetrunMetrics;
import com.fleetrun.worker.protocol.WorkerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Brings up a fixed set of workers for one run and tears them down at the end.
 *
 * <p>Workers are spawned together and each must send {@code ready} before the
 * shared spawn deadline. A worker that fails to start or misses the deadline is
 * killed and left out of the pool; the run continues with fewer workers. Only a
 * pool with no ready worker at all is an error.
 *
 * <p>The pool exclusively owns the channels. After {@link #start} returns, the
 * worker table is only touched from the run's coordinator thread and, once the
 * coordinator is idle, by {@link #terminateAll}.
 */
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final WorkerChannelFactory factory;
    private final String runId;
    private final Map<String, String> environment;
    private final Duration spawnTimeout;
    private final EventBus eventBus;
    private final FleetrunMetrics metrics;
    private final Map<Integer, Worker> workers = new LinkedHashMap<>();

    public WorkerPool(WorkerChannelFactory factory, String runId, Map<String, String> environment,
                      Duration spawnTimeout, EventBus eventBus, FleetrunMetrics metrics) {
        this.factory = factory;
        this.runId = runId;
        this.environment = environment;
        this.spawnTimeout = spawnTimeout;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Spawns {@code count} workers and waits for their handshakes.
     *
     * @param count    number of workers to start
     * @param listener receives every non-{@code ready} message and every exit of a
     *                 worker that completed its handshake, on the channel's thread
     * @return the workers that became ready, in id order
     */
    public List<Worker> start(int count, Listener listener) {
        var pending = new LinkedHashMap<Worker, CompletableFuture<Void>>();

        for (int id = 1; id <= count; id++) {
            var env = new LinkedHashMap<>(environment);
            env.put("WORKER_ID", String.valueOf(id));
            env.put("FLEETRUN_WORKER", "true");
            env.put("FLEETRUN_RUN_ID", runId);

            WorkerChannel channel;
            try {
                log.debug("Creating worker {}", id);
                channel = factory.spawn(new WorkerSpec(id, runId, env));
            } catch (WorkerSpawnException e) {
                log.error("Worker {} could not be started: {}", id, e.getMessage());
                recordSpawnFailure(id, e.getMessage());
                continue;
            }

            var worker = new Worker(id, channel);
            var ready = new CompletableFuture<Void>();
            channel.onMessage(message -> {
                if (message instanceof WorkerMessage.Ready) {
                    if (!ready.complete(null)) {
                        log.debug("Worker {} sent a duplicate ready", worker.id());
                    }
                    return;
                }
                listener.onMessage(worker, message);
            });
            channel.onExit(() -> {
                if (ready.completeExceptionally(new WorkerSpawnException("exited before sending ready"))
                        || ready.isCompletedExceptionally()) {
                    return;
                }
                listener.onDisconnect(worker);
            });
            channel.start();
            pending.put(worker, ready);
        }

        long deadline = System.nanoTime() + spawnTimeout.toNanos();
        for (var entry : pending.entrySet()) {
            Worker worker = entry.getKey();
            long remaining = Math.max(0, deadline - System.nanoTime());
            try {
                entry.getValue().get(remaining, TimeUnit.NANOSECONDS);
                workers.put(worker.id(), worker);
                metrics.recordWorkerSpawn(true);
                eventBus.emit("worker.ready", runId, null, Map.of("workerId", worker.id()));
                log.debug("Worker {} ready", worker.id());
            } catch (TimeoutException e) {
                log.error("Worker {} failed to start: no ready message within {}s",
                        worker.id(), spawnTimeout.toSeconds());
                entry.getValue().cancel(false);
                worker.channel().kill();
                recordSpawnFailure(worker.id(), "handshake timeout");
            } catch (ExecutionException e) {
                log.error("Worker {} failed to start: {}", worker.id(), e.getCause().getMessage());
                worker.channel().kill();
                recordSpawnFailure(worker.id(), e.getCause().getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                worker.channel().kill();
                throw new WorkerSpawnException("Interrupted while waiting for worker " + worker.id(), e);
            }
        }

        log.info("{} of {} workers ready", workers.size(), count);
        return List.copyOf(workers.values());
    }

    public Collection<Worker> workers() {
        return Collections.unmodifiableCollection(workers.values());
    }

    /** Workers that have not disconnected, in id order. */
    public List<Worker> liveWorkers() {
        var live = new ArrayList<Worker>();
        for (var worker : workers.values()) {
            if (!worker.isLost()) {
                live.add(worker);
            }
        }
        return live;
    }

    /**
     * Asks every connected worker to terminate, waits up to {@code grace} in total
     * for them to exit, then force-kills whatever is left.
     */
    public void terminateAll(Duration grace) {
        var stopping = new ArrayList<Worker>();
        for (var worker : workers.values()) {
            if (!worker.channel().isConnected()) {
                continue;
            }
            try {
                worker.channel().send(new WorkerMessage.Terminate());
                stopping.add(worker);
            } catch (WorkerChannelException e) {
                log.debug("Worker {} could not receive terminate: {}", worker.id(), e.getMessage());
                worker.channel().kill();
            }
        }

        long deadline = System.nanoTime() + grace.toNanos();
        for (var worker : stopping) {
            Duration remaining = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
            if (!worker.channel().awaitExit(remaining)) {
                log.warn("Worker {} did not exit within {}ms, killing it", worker.id(), grace.toMillis());
                worker.channel().kill();
            }
        }
        workers.clear();
    }

    /**
     * Callbacks from worker channels. Invoked on channel threads.
     */
    public interface Listener {

        void onMessage(Worker worker, WorkerMessage message);

        void onDisconnect(Worker worker);
    }

    private void recordSpawnFailure(int workerId, String reason) {
        metrics.recordWorkerSpawn(false);
        eventBus.emit("worker.spawn_failed", runId, null,
                Map.of("workerId", workerId, "reason", reason != null ? reason : "unknown"));
    }
}
