package com.fleetrun.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fleetrun.core.engine.RunOptions;
import com.fleetrun.core.engine.RunProperties;
import com.fleetrun.core.engine.RunStartException;
import com.fleetrun.core.engine.Supervisor;
import com.fleetrun.core.events.EventBus;
import com.fleetrun.core.model.Feature;
import com.fleetrun.core.model.RunReport;
import com.fleetrun.worker.WorkerProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: fleetrun run &lt;features-file&gt;
 * <p>
 * Loads parsed features, runs them on the worker pool and prints a summary.
 * Exits 0 when every item passed or was skipped, 1 when anything failed,
 * 2 when the run could not start.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run features on a pool of workers")
@Component
public class RunCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURES = 1;
    static final int EXIT_NOT_STARTED = 2;

    @Parameters(index = "0", description = "Parsed features file (.json, .yaml or .yml)")
    private Path featuresFile;

    @Option(names = {"--workers", "-w"}, description = "Maximum number of workers (default: PARALLEL_WORKERS, then config, then CPU count)")
    private Integer workers;

    @Option(names = {"--deadline"}, description = "Global deadline in seconds")
    private Integer deadlineSeconds;

    @Option(names = {"--in-process"}, description = "Run workers as threads instead of child processes")
    private boolean inProcess;

    @Option(names = {"--output", "-o"}, description = "Write the result set as JSON to this file")
    private Path output;

    @Option(names = {"--watch"}, description = "Print run events as they happen")
    private boolean watch;

    private final Supervisor supervisor;
    private final FeatureLoader featureLoader;
    private final EventBus eventBus;
    private final WorkerProperties workerProperties;
    private final RunProperties runProperties;
    private final ObjectMapper objectMapper;

    public RunCommand(Supervisor supervisor, FeatureLoader featureLoader, EventBus eventBus,
                      WorkerProperties workerProperties, RunProperties runProperties, ObjectMapper objectMapper) {
        this.supervisor = supervisor;
        this.featureLoader = featureLoader;
        this.eventBus = eventBus;
        this.workerProperties = workerProperties;
        this.runProperties = runProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<Feature> features;
        try {
            features = featureLoader.load(featuresFile);
        } catch (FeatureLoadException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_NOT_STARTED;
        }

        RunOptions options = RunOptions.from(workerProperties, runProperties);
        if (workers != null) {
            if (workers < 1) {
                ConsoleOutput.error("--workers must be at least 1");
                return EXIT_NOT_STARTED;
            }
            options = options.withMaxWorkers(workers);
        }
        if (deadlineSeconds != null) {
            options = options.withDeadline(Duration.ofSeconds(deadlineSeconds));
        }
        if (inProcess) {
            options = options.withProvider("in-process");
        }

        ConsoleOutput.info("Running " + features.size() + " feature" + (features.size() != 1 ? "s" : "")
                + " with up to " + options.maxWorkers() + " workers (" + options.provider() + ")");

        EventBus.Subscription subscription = watch ? eventBus.subscribeAll(ConsoleOutput::watchEvent) : null;
        RunReport report;
        try {
            report = supervisor.run(features, options);
        } catch (RunStartException e) {
            ConsoleOutput.error("Run could not start: " + e.getMessage());
            return EXIT_NOT_STARTED;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }

        System.out.println();
        report.results().values().forEach(ConsoleOutput::scenarioResult);
        ConsoleOutput.summary(report);

        if (output != null) {
            try {
                writeReport(report, output);
                ConsoleOutput.success("Results written to " + output);
            } catch (IOException e) {
                ConsoleOutput.error("Could not write " + output + ": " + e.getMessage());
            }
        }

        if (report.hasFailures() || report.timedOut()) {
            ConsoleOutput.error("Run finished with failures.");
            return EXIT_FAILURES;
        }
        ConsoleOutput.success("All scenarios passed.");
        return EXIT_OK;
    }

    private void writeReport(RunReport report, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .writeValue(target.toFile(), report);
    }
}
