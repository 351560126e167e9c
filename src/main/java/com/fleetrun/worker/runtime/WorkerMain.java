package com.fleetrun.worker.runtime;

import com.fleetrun.worker.protocol.MessageCodec;
import com.fleetrun.worker.protocol.ProtocolException;
import com.fleetrun.worker.protocol.WorkerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.FileOutputStream;
import java.io.FileDescriptor;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Entry point of a worker child process.
 *
 * <p>Reads one JSON message per line from stdin and writes replies to stdout.
 * Everything else the process prints, logging included, is redirected to stderr
 * so it cannot interleave with protocol lines. Exits on {@code terminate} or EOF.
 */
public final class WorkerMain {

    private WorkerMain() {}

    public static void main(String[] args) {
        var protocolOut = new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8);
        System.setOut(System.err);

        Logger log = LoggerFactory.getLogger(WorkerMain.class);
        int workerId = parseWorkerId(System.getenv("WORKER_ID"));
        String runId = System.getenv("FLEETRUN_RUN_ID");
        var codec = new MessageCodec();

        var runtime = new WorkerRuntime(workerId, runId, ScenarioExecutors.load(WorkerMain.class.getClassLoader()),
                message -> {
                    synchronized (protocolOut) {
                        protocolOut.println(codec.encode(message));
                    }
                });

        runtime.ready();
        log.debug("Worker {} ready", workerId);

        try (var reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                WorkerMessage message;
                try {
                    message = codec.decode(line);
                } catch (ProtocolException e) {
                    log.warn("Worker {} could not decode input: {}", workerId, e.getMessage());
                    continue;
                }
                if (!runtime.handle(message)) {
                    break;
                }
            }
        } catch (IOException e) {
            log.error("Worker {} lost its input: {}", workerId, e.getMessage());
        } finally {
            runtime.shutdown();
        }
        log.debug("Worker {} exiting", workerId);
        System.exit(0);
    }

    static int parseWorkerId(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LoggerFactory.getLogger(WorkerMain.class).warn("Ignoring non-numeric WORKER_ID={}", value);
            return 0;
        }
    }
}
