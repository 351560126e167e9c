package com.fleetrun.core.expand;

import com.fleetrun.core.data.DataProvider;
import com.fleetrun.core.model.Examples;
import com.fleetrun.core.model.Feature;
import com.fleetrun.core.model.Scenario;
import com.fleetrun.core.model.ScenarioKey;
import com.fleetrun.core.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Flattens parsed features into a list of independently schedulable {@link WorkItem}s.
 *
 * <p>A plain scenario yields one item. A scenario outline yields one item per
 * example row, numbered {@code 1..K}, each carrying the row, the shared headers
 * and {@code totalIterations = K}. When the outline references an external
 * data source, its rows are fetched through the {@link DataProvider} and filtered;
 * a failed or empty fetch falls back to the inline rows. An outline left with
 * no rows runs once as a plain scenario.
 */
@Service
public class WorkItemExpander {

    private static final Logger log = LoggerFactory.getLogger(WorkItemExpander.class);

    private final DataProvider dataProvider;

    public WorkItemExpander(DataProvider dataProvider) {
        this.dataProvider = dataProvider;
    }

    public List<WorkItem> expand(List<Feature> features) {
        var items = new ArrayList<WorkItem>();
        int workId = 0;

        for (var feature : features) {
            for (int i = 0; i < feature.scenarios().size(); i++) {
                Scenario scenario = feature.scenarios().get(i).withBackground(feature.background());
                var key = new ScenarioKey(feature.name(), i, ScenarioNames.baseName(scenario.name()));

                Examples examples = scenario.isOutline() ? loadExamples(scenario.examples(), scenario.name()) : null;
                if (examples == null || examples.rows().isEmpty()) {
                    items.add(new WorkItem("work-" + (++workId), feature, scenario, i, key,
                            null, null, null, null));
                    continue;
                }

                int total = examples.rows().size();
                int iteration = 1;
                for (var row : examples.rows()) {
                    items.add(new WorkItem("work-" + (++workId), feature, scenario, i, key,
                            row, examples.headers(), iteration++, total));
                }
                log.debug("Expanded outline '{}' into {} iterations", scenario.name(), total);
            }
        }

        log.info("Built {} work items from {} features", items.size(), features.size());
        return items;
    }

    /**
     * Resolves the effective example table. Loaded rows replace the inline ones;
     * any failure leaves the inline table in place.
     */
    Examples loadExamples(Examples examples, String scenarioName) {
        var source = examples.dataSource();
        if (source == null) {
            return examples;
        }

        List<Map<String, String>> data;
        try {
            log.info("Loading external data for '{}' from {}: {}", scenarioName, source.type(), source.source());
            data = dataProvider.loadRows(source);
        } catch (RuntimeException e) {
            log.error("Failed to load external data for '{}': {}", scenarioName, e.getMessage());
            return examples;
        }

        Predicate<Map<String, String>> filter = RowFilter.compile(source.filter());
        var filtered = data.stream().filter(filter).toList();
        if (filtered.isEmpty()) {
            log.warn("No data loaded from external source {} for '{}'", source.source(), scenarioName);
            return examples;
        }

        List<String> headers = List.copyOf(filtered.get(0).keySet());
        var rows = new ArrayList<List<String>>(filtered.size());
        for (var item : filtered) {
            var row = new ArrayList<String>(headers.size());
            for (String header : headers) {
                String value = item.get(header);
                row.add(value != null ? value : "");
            }
            rows.add(row);
        }
        log.info("Loaded {} rows with headers: {}", rows.size(), String.join(", ", headers));
        return examples.withRows(headers, rows);
    }
}
