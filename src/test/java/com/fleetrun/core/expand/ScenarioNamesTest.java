package com.fleetrun.core.expand;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioNamesTest {

    @Test
    @DisplayName("strips trailing iteration markers")
    void stripsMarkers() {
        assertEquals("Login", ScenarioNames.baseName("Login [Iteration 2]"));
        assertEquals("Login", ScenarioNames.baseName("Login [Iteration 2/5]"));
        assertEquals("Login", ScenarioNames.baseName("Login (Example 3/5)"));
        assertEquals("Login", ScenarioNames.baseName("Login - Iteration 4"));
        assertEquals("Login", ScenarioNames.baseName("Login_iteration_1"));
        assertEquals("Login", ScenarioNames.baseName("Login [iteration 7]"));
    }

    @Test
    @DisplayName("leaves other names untouched")
    void keepsPlainNames() {
        assertEquals("Login [admin]", ScenarioNames.baseName("Login [admin]"));
        assertEquals("Iteration 2 of the plan", ScenarioNames.baseName("Iteration 2 of the plan"));
        assertEquals("", ScenarioNames.baseName(null));
    }

    @Test
    @DisplayName("iteration names round-trip to the base name")
    void iterationName() {
        String name = ScenarioNames.iterationName("Checkout", 3, 4);
        assertEquals("Checkout [Iteration 3/4]", name);
        assertEquals("Checkout", ScenarioNames.baseName(name));
    }
}
