package com.fleetrun.core.model;

import java.io.Serializable;

/**
 * Reference to an external table of example rows for a scenario outline.
 *
 * @param type      source format: "csv" or "json"
 * @param source    location of the data, a file path
 * @param sheet     optional sheet/table name within the source
 * @param delimiter optional column delimiter for delimited formats
 * @param filter    optional {@code column <op> value} row filter
 */
public record DataSourceSpec(
    String type,
    String source,
    String sheet,
    String delimiter,
    String filter
) implements Serializable {}
