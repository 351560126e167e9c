package com.fleetrun.core.engine;

import com.fleetrun.core.model.IterationOutcome;
import com.fleetrun.core.model.ScenarioKey;
import com.fleetrun.core.model.ScenarioResult;
import com.fleetrun.core.model.ScenarioStatus;
import com.fleetrun.core.model.WorkItem;
import com.fleetrun.core.publish.PublishRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Folds the iterations of each data-driven scenario into one consolidated result.
 *
 * <p>Results are bucketed by {@link ScenarioKey}. A bucket is emitted exactly once,
 * on the arrival that completes its {@code 1..totalIterations} set, and removed at
 * the same moment. Arrival order does not matter: iterations are keyed by number
 * and rendered sorted.
 *
 * <p>Coordinator-confined; the buckets are never exposed.
 */
public class IterationAggregator {

    private static final Logger log = LoggerFactory.getLogger(IterationAggregator.class);

    private static final String ELLIPSIS = "...";

    private final int summaryMaxChars;
    private final int shortErrorMaxChars;
    private final Map<ScenarioKey, Bucket> buckets = new LinkedHashMap<>();

    public IterationAggregator(int summaryMaxChars, int shortErrorMaxChars) {
        this.summaryMaxChars = summaryMaxChars;
        this.shortErrorMaxChars = shortErrorMaxChars;
    }

    /**
     * Adds one iteration result.
     *
     * @return the consolidated request when this result completes its bucket, empty otherwise
     * @throws IllegalArgumentException if {@code item} is not an iteration
     */
    public Optional<PublishRequest> accept(WorkItem item, ScenarioResult result) {
        if (!item.isIteration()) {
            throw new IllegalArgumentException(item.id() + " is not an iteration of a data-driven scenario");
        }

        Bucket bucket = buckets.computeIfAbsent(item.key(), k -> new Bucket(item));
        if (bucket.entries.containsKey(item.iterationNumber())) {
            log.warn("Duplicate iteration {} for '{}', ignoring {}", item.iterationNumber(), item.key(), item.id());
            return Optional.empty();
        }
        bucket.entries.put(item.iterationNumber(), new Entry(item, result));
        log.debug("'{}' has {}/{} iterations", item.key(), bucket.entries.size(), bucket.total);

        if (bucket.entries.size() < bucket.total) {
            return Optional.empty();
        }
        buckets.remove(item.key());
        return Optional.of(consolidate(bucket));
    }

    /**
     * Buckets still waiting for iterations, with the iteration numbers they lack.
     */
    public List<OpenBucket> openBuckets() {
        var open = new ArrayList<OpenBucket>();
        for (var entry : buckets.entrySet()) {
            Bucket bucket = entry.getValue();
            var missing = new ArrayList<Integer>();
            for (int i = 1; i <= bucket.total; i++) {
                if (!bucket.entries.containsKey(i)) {
                    missing.add(i);
                }
            }
            open.add(new OpenBucket(entry.getKey(), bucket.total, bucket.entries.size(), missing));
        }
        return open;
    }

    private PublishRequest consolidate(Bucket bucket) {
        var outcomes = new ArrayList<IterationOutcome>(bucket.total);
        var artifacts = new LinkedHashMap<String, List<String>>();
        long duration = 0;
        int passed = 0;
        int failed = 0;
        String error = null;
        String stackTrace = null;

        for (var entry : bucket.entries.values()) {
            ScenarioResult result = entry.result;
            duration += result.durationMs();
            if (result.status() == ScenarioStatus.FAILED) {
                failed++;
                if (error == null && result.error() != null && !result.error().isBlank()) {
                    error = result.error();
                }
                if (stackTrace == null && result.stackTrace() != null && !result.stackTrace().isBlank()) {
                    stackTrace = result.stackTrace();
                }
            } else if (result.status() == ScenarioStatus.PASSED) {
                passed++;
            }
            result.artifacts().forEach((kind, refs) ->
                    artifacts.computeIfAbsent(kind, k -> new ArrayList<>()).addAll(refs));

            Map<String, String> data = entry.item.exampleData();
            outcomes.add(new IterationOutcome(entry.item.iterationNumber(), result.status(), result.durationMs(),
                    result.error(), result.stackTrace(), data.isEmpty() ? result.testData() : data));
        }

        ScenarioStatus status = failed > 0 ? ScenarioStatus.FAILED : ScenarioStatus.PASSED;
        String summary = summarize(bucket.baseName, outcomes, passed, failed);
        log.info("Consolidated '{}': {} ({} passed, {} failed, {}ms)",
                bucket.baseName, status.label(), passed, failed, duration);

        return new PublishRequest(bucket.baseName, bucket.featureName, status, duration, error,
                artifacts, stackTrace, null, outcomes, summary, bucket.tags);
    }

    String summarize(String baseName, List<IterationOutcome> outcomes, int passed, int failed) {
        String header = "Data-driven scenario '" + baseName + "' ran " + outcomes.size()
                + " iterations: " + passed + " passed, " + failed + " failed";
        var sb = new StringBuilder(header);
        for (var outcome : outcomes) {
            sb.append('\n').append("Iteration-").append(outcome.iteration()).append(": ")
                    .append(outcome.status().label());
            if (outcome.status() == ScenarioStatus.FAILED && outcome.error() != null && !outcome.error().isBlank()) {
                sb.append(" [").append(shortError(outcome.error())).append(']');
            }
        }
        if (sb.length() <= summaryMaxChars) {
            return sb.toString();
        }
        int cut = Math.max(header.length(), summaryMaxChars - ELLIPSIS.length());
        return sb.substring(0, cut) + ELLIPSIS;
    }

    private String shortError(String error) {
        String firstLine = error.strip().lines().findFirst().orElse("");
        if (firstLine.length() <= shortErrorMaxChars) {
            return firstLine;
        }
        return firstLine.substring(0, Math.max(0, shortErrorMaxChars - ELLIPSIS.length())) + ELLIPSIS;
    }

    /**
     * A bucket that never completed.
     *
     * @param key      parent scenario
     * @param total    iterations expected
     * @param received iterations that arrived
     * @param missing  iteration numbers still outstanding
     */
    public record OpenBucket(ScenarioKey key, int total, int received, List<Integer> missing) {}

    private record Entry(WorkItem item, ScenarioResult result) {}

    private static final class Bucket {
        final int total;
        final String baseName;
        final String featureName;
        final List<String> tags;
        final TreeMap<Integer, Entry> entries = new TreeMap<>();

        Bucket(WorkItem first) {
            this.total = first.totalIterations();
            this.baseName = first.key().baseScenarioName();
            this.featureName = first.featureName();
            this.tags = first.scenario().tags();
        }
    }
}
