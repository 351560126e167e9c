package com.fleetrun.cli;

import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Root of the {@code fleetrun} command tree. Without a subcommand it prints the
 * banner and usage.
 */
@Command(
        name = "fleetrun",
        mixinStandardHelpOptions = true,
        version = ConsoleOutput.VERSION,
        description = "Runs test scenarios in parallel on a pool of isolated workers",
        subcommands = {
                RunCommand.class,
                VersionCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class FleetrunCommand implements Runnable {

    static final String LOGGER = "com.fleetrun";

    @Spec
    CommandSpec spec;

    @Option(names = "--debug", description = "Log orchestration details at DEBUG (place before the subcommand)")
    void setDebug(boolean debug) {
        if (debug) {
            LoggingSystem.get(FleetrunCommand.class.getClassLoader()).setLogLevel(LOGGER, LogLevel.DEBUG);
        }
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
