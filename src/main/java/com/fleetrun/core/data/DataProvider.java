package com.fleetrun.core.data;

import com.fleetrun.core.model.DataSourceSpec;

import java.util.List;
import java.util.Map;

/**
 * Loads example rows for a scenario outline from an external source.
 * Implementations: {@link FileDataProvider} (csv, json).
 */
public interface DataProvider {

    /**
     * Loads every row of the source. Each row maps header name to cell value,
     * in column order.
     *
     * @throws DataSourceException if the source is missing, unreadable or of an unknown type
     */
    List<Map<String, String>> loadRows(DataSourceSpec source);
}
