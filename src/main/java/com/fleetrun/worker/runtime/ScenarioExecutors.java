package com.fleetrun.worker.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ServiceLoader;

/**
 * Looks up the {@link ScenarioExecutor} a worker should use.
 */
public final class ScenarioExecutors {

    private static final Logger log = LoggerFactory.getLogger(ScenarioExecutors.class);

    private ScenarioExecutors() {}

    /**
     * Returns the first executor registered under
     * {@code META-INF/services/com.fleetrun.worker.runtime.ScenarioExecutor},
     * or a {@link DryRunScenarioExecutor} when none is registered.
     */
    public static ScenarioExecutor load(ClassLoader classLoader) {
        for (ScenarioExecutor executor : ServiceLoader.load(ScenarioExecutor.class, classLoader)) {
            log.info("Using scenario executor {}", executor.getClass().getName());
            return executor;
        }
        log.info("No scenario executor registered, using dry run");
        return new DryRunScenarioExecutor();
    }
}
