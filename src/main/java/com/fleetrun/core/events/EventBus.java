package com.fleetrun.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for run progress.
 *
 * <p>Events are published from the coordinator thread and from worker channel
 * threads, so delivery happens synchronously on whichever thread publishes.
 * Subscribers are either bound to one run or receive every run's events; both
 * kinds are served in registration order. A subscriber that throws is logged and
 * skipped.
 *
 * <p>Run-bound subscriptions that are still registered when a run ends are
 * dropped by {@link #closeRun}.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Registration> registrations = new CopyOnWriteArrayList<>();

    public void emit(String eventType, String runId, String workItemId, Map<String, Object> payload) {
        publish(FleetrunEvent.of(eventType, runId, workItemId, payload));
    }

    public void publish(FleetrunEvent event) {
        log.trace("{} [{}]", event.eventType(), event.runId());
        for (Registration registration : registrations) {
            if (registration.accepts(event)) {
                registration.deliver(event);
            }
        }
    }

    /**
     * Receives the events of one run until unsubscribed or until the run is closed.
     */
    public Subscription subscribe(String runId, Consumer<FleetrunEvent> consumer) {
        Objects.requireNonNull(runId, "runId");
        return register(new Registration(runId, consumer));
    }

    /**
     * Receives the events of every run. Used by watch mode, which subscribes
     * before the run id is known.
     */
    public Subscription subscribeAll(Consumer<FleetrunEvent> consumer) {
        return register(new Registration(null, consumer));
    }

    /**
     * Drops every subscription bound to {@code runId}.
     *
     * @return the number of subscriptions removed
     */
    public int closeRun(String runId) {
        int before = registrations.size();
        registrations.removeIf(registration -> runId.equals(registration.runId));
        int removed = before - registrations.size();
        if (removed > 0) {
            log.debug("Closed {} subscription(s) of run {}", removed, runId);
        }
        return removed;
    }

    public int subscriberCount() {
        return registrations.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private Subscription register(Registration registration) {
        registrations.add(registration);
        log.debug("Subscribed to {}", registration.runId != null ? "run " + registration.runId : "all runs");
        return () -> registrations.remove(registration);
    }

    /** Identity-compared so the same consumer can be registered twice. */
    private static final class Registration {

        private final String runId;
        private final Consumer<FleetrunEvent> consumer;

        private Registration(String runId, Consumer<FleetrunEvent> consumer) {
            this.runId = runId;
            this.consumer = Objects.requireNonNull(consumer, "consumer");
        }

        boolean accepts(FleetrunEvent event) {
            return runId == null || runId.equals(event.runId());
        }

        void deliver(FleetrunEvent event) {
            try {
                consumer.accept(event);
            } catch (RuntimeException e) {
                log.warn("Subscriber failed on {} for run {}: {}", event.eventType(), event.runId(), e.getMessage(), e);
            }
        }
    }
}
