package com.fleetrun.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Example table of a scenario outline. Rows are positional and aligned with {@code headers}.
 *
 * @param headers    column names
 * @param rows       inline rows, each the same width as {@code headers}
 * @param dataSource optional external source that replaces the inline rows when it loads
 */
public record Examples(
    List<String> headers,
    List<List<String>> rows,
    DataSourceSpec dataSource
) implements Serializable {

    public Examples {
        headers = headers != null ? List.copyOf(headers) : List.of();
        rows = rows != null ? rows.stream().map(List::copyOf).toList() : List.of();
    }

    public Examples withRows(List<String> newHeaders, List<List<String>> newRows) {
        return new Examples(newHeaders, newRows, dataSource);
    }
}
