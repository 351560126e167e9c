package com.fleetrun.worker.process;

import com.fleetrun.worker.WorkerChannel;
import com.fleetrun.worker.WorkerChannelException;
import com.fleetrun.worker.protocol.MessageCodec;
import com.fleetrun.worker.protocol.ProtocolException;
import com.fleetrun.worker.protocol.WorkerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * A worker running as an OS child process. Messages travel as JSON lines over the
 * child's stdin and stdout; stderr is drained and logged at debug.
 *
 * <p>Lines on stdout that are not protocol messages are logged and skipped, so a
 * stray {@code println} in test code cannot break the channel.
 */
public class ProcessWorkerChannel implements WorkerChannel {

    private static final Logger log = LoggerFactory.getLogger(ProcessWorkerChannel.class);

    private final int workerId;
    private final Process process;
    private final MessageCodec codec;
    private final BufferedWriter stdin;
    private volatile Consumer<WorkerMessage> messageHandler = message -> {};
    private volatile Runnable exitHandler = () -> {};
    private volatile boolean connected = true;

    ProcessWorkerChannel(int workerId, Process process, MessageCodec codec) {
        this.workerId = workerId;
        this.process = process;
        this.codec = codec;
        this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
    }

    @Override
    public void start() {
        var stdoutPump = new Thread(this::pumpStdout, "fleetrun-worker-" + workerId + "-out");
        stdoutPump.setDaemon(true);
        stdoutPump.start();

        var stderrPump = new Thread(this::pumpStderr, "fleetrun-worker-" + workerId + "-err");
        stderrPump.setDaemon(true);
        stderrPump.start();
    }

    @Override
    public int workerId() {
        return workerId;
    }

    @Override
    public synchronized void send(WorkerMessage message) {
        if (!connected) {
            throw new WorkerChannelException("Worker " + workerId + " is not connected");
        }
        try {
            stdin.write(codec.encode(message));
            stdin.newLine();
            stdin.flush();
        } catch (IOException e) {
            throw new WorkerChannelException("Failed to write to worker " + workerId, e);
        }
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
    public boolean isConnected() {
        return connected && process.isAlive();
    }

    @Override
    public boolean awaitExit(Duration timeout) {
        try {
            return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !process.isAlive();
        }
    }

    @Override
    public void kill() {
        connected = false;
        process.destroyForcibly();
    }

    private void pumpStdout() {
        try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                WorkerMessage message;
                try {
                    message = codec.decode(line);
                } catch (ProtocolException e) {
                    log.debug("worker {} stdout: {}", workerId, line);
                    continue;
                }
                messageHandler.accept(message);
            }
        } catch (IOException e) {
            log.debug("Worker {} stdout closed: {}", workerId, e.getMessage());
        } finally {
            connected = false;
            logExit();
            exitHandler.run();
        }
    }

    private void pumpStderr() {
        try (var reader = new BufferedReader(new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("worker {} stderr: {}", workerId, line);
            }
        } catch (IOException e) {
            log.debug("Worker {} stderr closed: {}", workerId, e.getMessage());
        }
    }

    private void logExit() {
        if (awaitExit(Duration.ofSeconds(1))) {
            int code = process.exitValue();
            if (code == 0) {
                log.debug("Worker {} exited", workerId);
            } else {
                log.warn("Worker {} exited with code {}", workerId, code);
            }
        }
    }
}
