package com.fleetrun.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a run, used for CLI watch mode and progress reporting.
 *
 * @param eventType  event type (e.g. "run.started", "item.dispatched", "scenario.published")
 * @param runId      the run this event belongs to
 * @param workItemId the work item this event relates to (nullable for run- and worker-level events)
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record FleetrunEvent(
    String eventType,
    String runId,
    String workItemId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static FleetrunEvent of(String eventType, String runId, String workItemId, Map<String, Object> payload) {
        return new FleetrunEvent(eventType, runId, workItemId, payload, Instant.now());
    }
}
