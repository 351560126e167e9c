package com.fleetrun.worker.local;

import com.fleetrun.worker.WorkerChannel;
import com.fleetrun.worker.WorkerChannelFactory;
import com.fleetrun.worker.WorkerSpec;
import com.fleetrun.worker.runtime.ScenarioExecutor;

import java.util.function.Supplier;

/**
 * Runs workers as threads of the orchestrator JVM, each with its own executor instance.
 */
public class InProcessWorkerChannelFactory implements WorkerChannelFactory {

    private final Supplier<ScenarioExecutor> executors;

    public InProcessWorkerChannelFactory(Supplier<ScenarioExecutor> executors) {
        this.executors = executors;
    }

    @Override
    public String provider() {
        return "in-process";
    }

    @Override
    public WorkerChannel spawn(WorkerSpec spec) {
        return new InProcessWorkerChannel(spec.workerId(), spec.runId(), executors.get());
    }
}
