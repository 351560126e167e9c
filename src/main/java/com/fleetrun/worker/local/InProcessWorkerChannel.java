package com.fleetrun.worker.local;

import com.fleetrun.core.logging.MdcContext;
import com.fleetrun.worker.WorkerChannel;
import com.fleetrun.worker.WorkerChannelException;
import com.fleetrun.worker.protocol.WorkerMessage;
import com.fleetrun.worker.runtime.ScenarioExecutor;
import com.fleetrun.worker.runtime.WorkerRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * A worker running on a dedicated thread inside this JVM. Isolation is limited to
 * the thread; use it for tests and for executors that are known to be well behaved.
 */
public class InProcessWorkerChannel implements WorkerChannel {

    private static final Logger log = LoggerFactory.getLogger(InProcessWorkerChannel.class);

    private final int workerId;
    private final String runId;
    private final BlockingQueue<WorkerMessage> inbox = new LinkedBlockingQueue<>();
    private final Thread thread;
    private final WorkerRuntime runtime;
    private volatile Consumer<WorkerMessage> messageHandler = message -> {};
    private volatile Runnable exitHandler = () -> {};
    private volatile boolean connected = true;

    InProcessWorkerChannel(int workerId, String runId, ScenarioExecutor executor) {
        this.workerId = workerId;
        this.runId = runId;
        this.runtime = new WorkerRuntime(workerId, runId, executor, message -> messageHandler.accept(message));
        this.thread = new Thread(this::loop, "fleetrun-local-worker-" + workerId);
        this.thread.setDaemon(true);
    }

    @Override
    public int workerId() {
        return workerId;
    }

    @Override
    public void send(WorkerMessage message) {
        if (!connected) {
            throw new WorkerChannelException("Worker " + workerId + " is not connected");
        }
        inbox.add(message);
    }

    @Override
    public void onMessage(Consumer<WorkerMessage> handler) {
        this.messageHandler = handler;
    }

    @Override
    public void onExit(Runnable handler) {
        this.exitHandler = handler;
    }

    @Override
    public void start() {
        thread.start();
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public boolean awaitExit(Duration timeout) {
        try {
            thread.join(Math.max(1, timeout.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !thread.isAlive();
    }

    @Override
    public void kill() {
        connected = false;
        thread.interrupt();
    }

    private void loop() {
        MdcContext.setWorker(runId, workerId);
        try {
            runtime.ready();
            while (connected) {
                WorkerMessage message = inbox.take();
                if (!runtime.handle(message)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            log.debug("Worker {} interrupted", workerId);
            Thread.currentThread().interrupt();
        } finally {
            runtime.shutdown();
            connected = false;
            MdcContext.clear();
            exitHandler.run();
        }
    }
}
