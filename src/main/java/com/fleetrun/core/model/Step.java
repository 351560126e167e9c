package com.fleetrun.core.model;

import java.io.Serializable;

/**
 * A single Given/When/Then line of a scenario or background.
 *
 * @param keyword the step keyword, e.g. "Given"
 * @param text    the step text after the keyword
 */
public record Step(
    String keyword,
    String text
) implements Serializable {}
