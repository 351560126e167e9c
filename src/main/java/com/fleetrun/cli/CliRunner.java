package com.fleetrun.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree inside the Boot application and keeps its exit
 * code for {@link org.springframework.boot.SpringApplication#exit}.
 *
 * <p>Usage errors exit with 2 (picocli's default). An exception escaping a
 * command is reported on the console and also exits with 2: the run never
 * produced a report.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final FleetrunCommand rootCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(FleetrunCommand rootCommand, IFactory factory) {
        this.rootCommand = rootCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine().execute(args);
        log.debug("fleetrun exited with {}", exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    CommandLine commandLine() {
        var commandLine = new CommandLine(rootCommand, factory);
        commandLine.setExecutionExceptionHandler((e, cl, parseResult) -> {
            log.error("Command '{}' failed", cl.getCommandName(), e);
            ConsoleOutput.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            return RunCommand.EXIT_NOT_STARTED;
        });
        return commandLine;
    }
}
