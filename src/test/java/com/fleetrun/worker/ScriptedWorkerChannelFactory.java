package com.fleetrun.worker;

import com.fleetrun.core.model.ScenarioStatus;
import com.fleetrun.worker.protocol.WorkerMessage;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Worker channel fake whose behaviour is scripted per execute message.
 * Each channel runs on its own thread and handles one message at a time,
 * like a real worker.
 */
public class ScriptedWorkerChannelFactory implements WorkerChannelFactory {

    public static final String PROVIDER = "scripted";

    /** Decides how a worker reacts to an execute. Called on the worker's thread. */
    @FunctionalInterface
    public interface Script {
        Reaction onExecute(int workerId, WorkerMessage.Execute execute);
    }

    public record Reaction(Kind kind, ScenarioStatus status, String error, long delayMs) {

        public enum Kind { REPLY, HANG, DISCONNECT }

        public static Reaction pass() {
            return new Reaction(Kind.REPLY, ScenarioStatus.PASSED, null, 0);
        }

        public static Reaction pass(long delayMs) {
            return new Reaction(Kind.REPLY, ScenarioStatus.PASSED, null, delayMs);
        }

        public static Reaction fail(String error) {
            return new Reaction(Kind.REPLY, ScenarioStatus.FAILED, error, 0);
        }

        public static Reaction fail(String error, long delayMs) {
            return new Reaction(Kind.REPLY, ScenarioStatus.FAILED, error, delayMs);
        }

        public static Reaction hang() {
            return new Reaction(Kind.HANG, null, null, 0);
        }

        public static Reaction disconnect() {
            return new Reaction(Kind.DISCONNECT, null, null, 0);
        }
    }

    private final Script script;
    private final Set<Integer> silentWorkers = ConcurrentHashMap.newKeySet();
    private final Set<Integer> unstartableWorkers = ConcurrentHashMap.newKeySet();
    private final List<ScriptedChannel> channels = new CopyOnWriteArrayList<>();
    private final List<String> executed = new CopyOnWriteArrayList<>();
    private final AtomicInteger overlappingExecutes = new AtomicInteger();

    public ScriptedWorkerChannelFactory(Script script) {
        this.script = script;
    }

    public static ScriptedWorkerChannelFactory passing() {
        return new ScriptedWorkerChannelFactory((id, execute) -> Reaction.pass());
    }

    /** The worker with this id starts but never sends ready. */
    public ScriptedWorkerChannelFactory silent(int workerId) {
        silentWorkers.add(workerId);
        return this;
    }

    /** Spawning the worker with this id fails outright. */
    public ScriptedWorkerChannelFactory unstartable(int workerId) {
        unstartableWorkers.add(workerId);
        return this;
    }

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public WorkerChannel spawn(WorkerSpec spec) {
        if (unstartableWorkers.contains(spec.workerId())) {
            throw new WorkerSpawnException("scripted spawn failure for worker " + spec.workerId());
        }
        var channel = new ScriptedChannel(spec.workerId(), !silentWorkers.contains(spec.workerId()), spec.environment());
        channels.add(channel);
        return channel;
    }

    public int spawnCount() {
        return channels.size();
    }

    public List<ScriptedChannel> channels() {
        return channels;
    }

    /** Item ids in the order execute messages reached any worker. */
    public List<String> executed() {
        return executed;
    }

    /** Execute messages that reached a worker still holding an unanswered one. */
    public int overlappingExecutes() {
        return overlappingExecutes.get();
    }

    public final class ScriptedChannel implements WorkerChannel {

        private final int workerId;
        private final boolean sendsReady;
        private final Map<String, String> environment;
        private final BlockingQueue<WorkerMessage> inbox = new LinkedBlockingQueue<>();
        private final Thread thread;
        private volatile Consumer<WorkerMessage> messageHandler = message -> {};
        private volatile Runnable exitHandler = () -> {};
        private volatile boolean connected = true;
        private volatile boolean killed;
        private volatile boolean terminateReceived;
        private volatile String outstanding;

        ScriptedChannel(int workerId, boolean sendsReady, Map<String, String> environment) {
            this.workerId = workerId;
            this.sendsReady = sendsReady;
            this.environment = environment;
            this.thread = new Thread(this::loop, "scripted-worker-" + workerId);
            this.thread.setDaemon(true);
        }

        public Map<String, String> environment() {
            return environment;
        }

        public boolean wasKilled() {
            return killed;
        }

        public boolean receivedTerminate() {
            return terminateReceived;
        }

        @Override
        public int workerId() {
            return workerId;
        }

        @Override
        public void send(WorkerMessage message) {
            if (!connected) {
                throw new WorkerChannelException("scripted worker " + workerId + " is gone");
            }
            if (message instanceof WorkerMessage.Execute execute) {
                if (outstanding != null) {
                    overlappingExecutes.incrementAndGet();
                }
                outstanding = execute.scenarioId();
                executed.add(execute.scenarioId());
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
            killed = true;
            connected = false;
            thread.interrupt();
        }

        private void loop() {
            try {
                if (sendsReady) {
                    messageHandler.accept(new WorkerMessage.Ready(workerId));
                }
                while (connected) {
                    WorkerMessage message = inbox.take();
                    if (message instanceof WorkerMessage.Terminate) {
                        terminateReceived = true;
                        return;
                    }
                    if (message instanceof WorkerMessage.Execute execute) {
                        Reaction reaction = script.onExecute(workerId, execute);
                        if (reaction.kind() == Reaction.Kind.DISCONNECT) {
                            return;
                        }
                        if (reaction.kind() == Reaction.Kind.HANG) {
                            continue;
                        }
                        if (reaction.delayMs() > 0) {
                            Thread.sleep(reaction.delayMs());
                        }
                        outstanding = null;
                        messageHandler.accept(new WorkerMessage.Result(execute.scenarioId(), null,
                                reaction.status(), reaction.delayMs(), reaction.error(), null,
                                Map.of(), Map.of()));
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                connected = false;
                exitHandler.run();
            }
        }
    }
}
