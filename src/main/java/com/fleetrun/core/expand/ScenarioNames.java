package com.fleetrun.core.expand;

import java.util.regex.Pattern;

/**
 * Derives the base name of a data-driven scenario from an iteration display name.
 */
public final class ScenarioNames {

    /**
     * Trailing iteration markers produced by workers and reporters, e.g.
     * {@code "Login [Iteration 2]"}, {@code "Login (Example 3/5)"},
     * {@code "Login - Iteration 4"} or {@code "Login_iteration_1"}.
     */
    static final Pattern ITERATION_SUFFIX = Pattern.compile(
            "(?i)(?:\\s*[\\[(]\\s*(?:iteration|example|row)\\s*#?\\s*\\d+(?:\\s*(?:/|of)\\s*\\d+)?\\s*[\\])]"
                    + "|\\s+-\\s+(?:iteration|example|row)\\s*#?\\s*\\d+"
                    + "|_iteration_\\d+)\\s*$"
    );

    private ScenarioNames() {}

    public static String baseName(String name) {
        if (name == null) {
            return "";
        }
        return ITERATION_SUFFIX.matcher(name).replaceFirst("").trim();
    }

    public static String iterationName(String baseName, int iteration, int total) {
        return baseName + " [Iteration " + iteration + "/" + total + "]";
    }
}
