package com.fleetrun.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.List;

/**
 * A parsed scenario (or scenario outline when {@code examples} is present).
 *
 * @param name       display name
 * @param tags       scenario-level tags
 * @param steps      scenario steps
 * @param examples   example table for outlines, {@code null} for plain scenarios
 * @param background feature background steps, attached before dispatch
 */
public record Scenario(
    String name,
    List<String> tags,
    List<Step> steps,
    Examples examples,
    List<Step> background
) implements Serializable {

    public Scenario {
        tags = tags != null ? List.copyOf(tags) : List.of();
        steps = steps != null ? List.copyOf(steps) : List.of();
        background = background != null ? List.copyOf(background) : List.of();
    }

    @JsonIgnore
    public boolean isOutline() {
        return examples != null;
    }

    public Scenario withBackground(List<Step> featureBackground) {
        return new Scenario(name, tags, steps, examples, featureBackground);
    }
}
