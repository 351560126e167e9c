package com.fleetrun.worker.runtime;

import com.fleetrun.core.logging.MdcContext;
import com.fleetrun.core.model.ScenarioStatus;
import com.fleetrun.worker.protocol.WorkerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.function.Consumer;

/**
 * Worker-side protocol loop, independent of transport.
 *
 * <p>Sends {@code ready} once, then answers every {@code execute} with exactly one
 * {@code result}. Executor failures become failed results; the worker itself keeps
 * going. {@code terminate} closes the executor and ends the loop.
 */
public class WorkerRuntime {

    private static final Logger log = LoggerFactory.getLogger(WorkerRuntime.class);

    private final int workerId;
    private final String runId;
    private final ScenarioExecutor executor;
    private final Consumer<WorkerMessage> outbound;
    private boolean terminated;

    public WorkerRuntime(int workerId, String runId, ScenarioExecutor executor, Consumer<WorkerMessage> outbound) {
        this.workerId = workerId;
        this.runId = runId;
        this.executor = executor;
        this.outbound = outbound;
    }

    public void ready() {
        outbound.accept(new WorkerMessage.Ready(workerId));
    }

    /**
     * Handles one inbound message.
     *
     * @return false once the worker should stop reading
     */
    public boolean handle(WorkerMessage message) {
        if (terminated) {
            return false;
        }
        if (message instanceof WorkerMessage.Execute execute) {
            outbound.accept(execute(execute));
            return true;
        }
        if (message instanceof WorkerMessage.Terminate) {
            shutdown();
            return false;
        }
        log.warn("Worker {} ignoring unexpected {}", workerId, message.getClass().getSimpleName());
        outbound.accept(new WorkerMessage.Error("Unexpected message: " + message.getClass().getSimpleName()));
        return true;
    }

    /**
     * Closes the executor. Safe to call more than once.
     */
    public void shutdown() {
        if (terminated) {
            return;
        }
        terminated = true;
        try {
            executor.close();
        } catch (RuntimeException e) {
            log.warn("Worker {} executor cleanup failed: {}", workerId, e.getMessage(), e);
        }
    }

    public boolean isTerminated() {
        return terminated;
    }

    WorkerMessage.Result execute(WorkerMessage.Execute execute) {
        MdcContext.setWorkItem(runId, workerId, execute.scenarioId());
        long start = System.currentTimeMillis();
        try {
            var request = ExecutionRequest.from(execute);
            log.debug("Executing '{}'", execute.scenario().name());
            ExecutionOutcome outcome = executor.execute(request);
            long duration = System.currentTimeMillis() - start;
            if (outcome == null) {
                return WorkerMessage.Result.failed(execute.scenarioId(), duration, "Executor returned no outcome", null);
            }
            ScenarioStatus status = outcome.status() != null ? outcome.status() : ScenarioStatus.FAILED;
            return new WorkerMessage.Result(execute.scenarioId(), outcome.name(), status, duration,
                    outcome.error(), outcome.stackTrace(), outcome.artifacts(), outcome.testData());
        } catch (Exception e) {
            long duration = System.currentTimeMillis() - start;
            log.error("Worker {} failed executing {}: {}", workerId, execute.scenarioId(), e.getMessage(), e);
            return WorkerMessage.Result.failed(execute.scenarioId(), duration,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getName(), stackTraceOf(e));
        } finally {
            MdcContext.clearWorkItem();
        }
    }

    static String stackTraceOf(Throwable t) {
        var sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }
}
