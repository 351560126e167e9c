package com.fleetrun.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A parsed feature file, supplied by the feature parser and read-only from here on.
 *
 * @param name       feature name
 * @param uri        location of the feature source, informational
 * @param tags       feature-level tags
 * @param background steps run before every scenario of the feature
 * @param scenarios  scenarios in file order
 */
public record Feature(
    String name,
    String uri,
    List<String> tags,
    List<Step> background,
    List<Scenario> scenarios
) implements Serializable {

    public Feature {
        tags = tags != null ? List.copyOf(tags) : List.of();
        background = background != null ? List.copyOf(background) : List.of();
        scenarios = scenarios != null ? List.copyOf(scenarios) : List.of();
    }
}
