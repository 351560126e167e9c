package com.fleetrun.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

@Command(name = "version", description = "Print the Fleetrun version")
@Component
public class VersionCommand implements Runnable {

    @Override
    public void run() {
        System.out.println(ConsoleOutput.VERSION);
    }
}
