package com.fleetrun;

import com.fleetrun.core.model.DataSourceSpec;
import com.fleetrun.core.model.Examples;
import com.fleetrun.core.model.Feature;
import com.fleetrun.core.model.Scenario;
import com.fleetrun.core.model.Step;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builders for parsed features used across tests.
 */
public final class FeatureFixtures {

    private FeatureFixtures() {}

    public static Feature feature(String name, Scenario... scenarios) {
        return new Feature(name, name.toLowerCase().replace(' ', '-') + ".feature", List.of(),
                List.of(), Arrays.asList(scenarios));
    }

    public static Feature featureWithBackground(String name, List<Step> background, Scenario... scenarios) {
        return new Feature(name, null, List.of(), background, Arrays.asList(scenarios));
    }

    public static Scenario plain(String name, String... tags) {
        return new Scenario(name, Arrays.asList(tags), List.of(new Step("Given", "a step")), null, null);
    }

    /**
     * Outline with one {@code user} column and {@code rows} rows: user-1, user-2, ...
     */
    public static Scenario outline(String name, int rows, String... tags) {
        var data = new ArrayList<List<String>>();
        for (int i = 1; i <= rows; i++) {
            data.add(List.of("user-" + i));
        }
        return new Scenario(name, Arrays.asList(tags), List.of(new Step("When", "<user> logs in")),
                new Examples(List.of("user"), data, null), null);
    }

    public static Scenario outlineWithSource(String name, DataSourceSpec source, List<String> headers,
                                             List<List<String>> inlineRows) {
        return new Scenario(name, List.of(), List.of(new Step("When", "<user> logs in")),
                new Examples(headers, inlineRows, source), null);
    }
}
