package com.fleetrun.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Outcome of a scenario execution as reported by a worker.
 */
public enum ScenarioStatus {
    PASSED,
    FAILED,
    SKIPPED;

    private static final Logger log = LoggerFactory.getLogger(ScenarioStatus.class);

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }

    /**
     * Reads a reported status. Test runners also report states such as
     * {@code pending}, {@code undefined} or {@code ambiguous}; anything that is
     * not passed or failed counts as skipped.
     */
    @JsonCreator
    public static ScenarioStatus fromLabel(String label) {
        if (label == null) {
            return null;
        }
        return switch (label.trim().toLowerCase()) {
            case "passed" -> PASSED;
            case "failed" -> FAILED;
            case "skipped" -> SKIPPED;
            default -> {
                log.warn("Unknown scenario status '{}', treating it as skipped", label);
                yield SKIPPED;
            }
        };
    }
}
