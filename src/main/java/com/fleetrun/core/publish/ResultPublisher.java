package com.fleetrun.core.publish;

/**
 * Downstream sink for scenario outcomes, e.g. an issue-tracker integration.
 *
 * <p>Called exactly once per logical scenario: once for a plain scenario,
 * once with the consolidated result for a data-driven one. Calls arrive
 * from the run's coordinator thread, one at a time.
 */
public interface ResultPublisher {

    void publish(PublishRequest request);
}
