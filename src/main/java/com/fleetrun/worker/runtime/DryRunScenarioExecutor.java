package com.fleetrun.worker.runtime;

import com.fleetrun.core.expand.ScenarioNames;
import com.fleetrun.core.model.Step;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Walks the steps without running anything. Scenarios tagged {@code @dry-run-fail}
 * fail, everything else passes.
 *
 * <p>The reported name has {@code <column>} placeholders replaced with example
 * values, and iterations get an {@code [Iteration i/n]} suffix.
 */
public class DryRunScenarioExecutor implements ScenarioExecutor {

    static final String FAIL_TAG = "@dry-run-fail";

    private static final Pattern PLACEHOLDER = Pattern.compile("<([^<>]+)>");

    @Override
    public ExecutionOutcome execute(ExecutionRequest request) {
        String name = interpolate(request.scenario().name(), request.exampleData());
        if (request.isIteration()) {
            name = ScenarioNames.iterationName(name, request.iterationNumber(), request.totalIterations());
        }

        if (request.scenario().tags().contains(FAIL_TAG)) {
            Step last = request.scenario().steps().isEmpty()
                    ? null : request.scenario().steps().get(request.scenario().steps().size() - 1);
            String where = last != null ? last.keyword() + " " + interpolate(last.text(), request.exampleData()) : "scenario";
            return ExecutionOutcome.failed(name, "Dry run failure at: " + where.trim(), request.exampleData());
        }
        return ExecutionOutcome.passed(name, request.exampleData());
    }

    static String interpolate(String text, Map<String, String> values) {
        if (text == null || values.isEmpty()) {
            return text;
        }
        Matcher m = PLACEHOLDER.matcher(text);
        var sb = new StringBuilder();
        while (m.find()) {
            String value = values.get(m.group(1));
            m.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : m.group(0)));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
