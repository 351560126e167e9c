package com.fleetrun.worker.process;

import com.fleetrun.worker.WorkerChannel;
import com.fleetrun.worker.WorkerChannelFactory;
import com.fleetrun.worker.WorkerSpawnException;
import com.fleetrun.worker.WorkerSpec;
import com.fleetrun.worker.protocol.MessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Launches workers as child processes.
 *
 * <p>With no configured command, the worker is started with the current JVM and
 * class path running {@code com.fleetrun.worker.runtime.WorkerMain}. When the
 * orchestrator itself runs from a repackaged jar, set {@code fleetrun.worker.command}
 * to {@code java -jar fleetrun.jar worker}.
 */
public class ProcessWorkerChannelFactory implements WorkerChannelFactory {

    private static final Logger log = LoggerFactory.getLogger(ProcessWorkerChannelFactory.class);

    static final String WORKER_MAIN = "com.fleetrun.worker.runtime.WorkerMain";

    private final List<String> command;
    private final MessageCodec codec;

    public ProcessWorkerChannelFactory(List<String> command, MessageCodec codec) {
        this.command = command == null || command.isEmpty() ? defaultCommand() : List.copyOf(command);
        this.codec = codec;
    }

    @Override
    public String provider() {
        return "process";
    }

    @Override
    public WorkerChannel spawn(WorkerSpec spec) {
        var builder = new ProcessBuilder(command);
        builder.environment().putAll(spec.environment());
        try {
            Process process = builder.start();
            log.debug("Started worker {} as pid {}", spec.workerId(), process.pid());
            return new ProcessWorkerChannel(spec.workerId(), process, codec);
        } catch (IOException e) {
            throw new WorkerSpawnException("Failed to launch worker " + spec.workerId() + ": " + command.get(0), e);
        }
    }

    List<String> command() {
        return command;
    }

    static List<String> defaultCommand() {
        var cmd = new ArrayList<String>();
        cmd.add(Path.of(System.getProperty("java.home"), "bin", "java").toString());
        cmd.add("-cp");
        cmd.add(System.getProperty("java.class.path"));
        cmd.add(WORKER_MAIN);
        return cmd;
    }
}
