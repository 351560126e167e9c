package com.fleetrun.worker;

import com.fleetrun.worker.protocol.WorkerMessage;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Handle to one isolated execution unit. Implementations: {@code ProcessWorkerChannel}
 * (OS child process, JSON lines over stdio) and {@code InProcessWorkerChannel}
 * (a dedicated thread in this JVM).
 *
 * <p>The coordinator only ever talks to a worker through this interface.
 */
public interface WorkerChannel {

    int workerId();

    /**
     * Delivers a message to the worker.
     *
     * @throws WorkerChannelException if the channel is closed or the write fails
     */
    void send(WorkerMessage message);

    /**
     * Registers the handler for messages coming from the worker. Called on the
     * channel's own reader thread; handlers must hand work off rather than block.
     */
    void onMessage(Consumer<WorkerMessage> handler);

    /**
     * Registers a callback run once when the worker goes away. It runs on the same
     * thread as message delivery, after the last message has been handed over.
     */
    void onExit(Runnable handler);

    /**
     * Begins delivering messages and the exit notification to the registered
     * handlers. Anything the worker sends earlier is held until then.
     */
    void start();

    /**
     * False once the worker has exited or its channel has been closed.
     */
    boolean isConnected();

    /**
     * Blocks up to {@code timeout} for the worker to exit.
     *
     * @return true if the worker has exited
     */
    boolean awaitExit(Duration timeout);

    /**
     * Forcibly stops the worker.
     */
    void kill();
}
