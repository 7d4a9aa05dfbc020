package com.keelson.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command. Without a subcommand it prints usage.
 */
@Command(
        name = "keelson",
        mixinStandardHelpOptions = true,
        version = "Keelson 0.1.0",
        description = "Coordinator for coding-agent sessions, task queues and terminals",
        subcommands = {
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class KeelsonCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
