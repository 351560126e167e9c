package com.fleetrun.worker.runtime;

import com.fleetrun.core.model.Scenario;
import com.fleetrun.core.model.ScenarioStatus;
import com.fleetrun.core.model.Step;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.fleetrun.FeatureFixtures.feature;
import static com.fleetrun.FeatureFixtures.outline;
import static com.fleetrun.FeatureFixtures.plain;
import static org.junit.jupiter.api.Assertions.*;

class DryRunScenarioExecutorTest {

    private final DryRunScenarioExecutor executor = new DryRunScenarioExecutor();

    @Test
    @DisplayName("plain scenarios pass under their own name")
    void plainPasses() {
        var f = feature("F", plain("browse catalogue"));

        var outcome = executor.execute(new ExecutionRequest("work-1", f, f.scenarios().get(0),
                Map.of(), Map.of(), null, null));

        assertEquals(ScenarioStatus.PASSED, outcome.status());
        assertEquals("browse catalogue", outcome.name());
    }

    @Test
    @DisplayName("iterations are named with their values and position")
    void iterationName() {
        var f = feature("F", outline("login as <user>", 2));

        var outcome = executor.execute(new ExecutionRequest("work-2", f, f.scenarios().get(0),
                Map.of(), Map.of("user", "ann"), 1, 2));

        assertEquals("login as ann [Iteration 1/2]", outcome.name());
        assertEquals(Map.of("user", "ann"), outcome.testData());
    }

    @Test
    @DisplayName("the fail tag fails at the last step")
    void failTag() {
        var scenario = new Scenario("checkout", List.of("@dry-run-fail"),
                List.of(new Step("Given", "a cart"), new Step("Then", "<user> pays")), null, null);
        var f = feature("F", scenario);

        var outcome = executor.execute(new ExecutionRequest("work-1", f, scenario,
                Map.of(), Map.of("user", "bo"), null, null));

        assertEquals(ScenarioStatus.FAILED, outcome.status());
        assertEquals("Dry run failure at: Then bo pays", outcome.error());
    }

    @Test
    @DisplayName("unknown placeholders are left in place")
    void interpolate() {
        assertEquals("a <b> $c", DryRunScenarioExecutor.interpolate("<a> <b> <c>", Map.of("a", "a", "c", "$c")));
        assertEquals("plain", DryRunScenarioExecutor.interpolate("plain", Map.of()));
    }
}
