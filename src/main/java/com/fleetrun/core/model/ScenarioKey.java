package com.fleetrun.core.model;

import java.io.Serializable;

/**
 * Structural identity of a parent scenario, shared by every iteration of an outline.
 * Two outlines with the same display name in the same feature stay distinct
 * because the scenario index is part of the key.
 *
 * @param featureName      owning feature name
 * @param scenarioIndex    position of the scenario within the feature
 * @param baseScenarioName scenario name without any iteration marker
 */
public record ScenarioKey(
    String featureName,
    int scenarioIndex,
    String baseScenarioName
) implements Serializable {

    @Override
    public String toString() {
        return featureName + "::" + baseScenarioName;
    }
}
