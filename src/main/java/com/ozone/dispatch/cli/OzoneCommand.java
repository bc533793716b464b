package com.ozone.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Ozone.
 * Routes to subcommands: run, status, health, serve.
 */
@Command(
        name = "ozone",
        mixinStandardHelpOptions = true,
        version = "Ozone 0.1.0",
        description = "Task orchestration and assessment engine",
        subcommands = {
                RunCommand.class,
                StatusCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class OzoneCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // No subcommand given
        spec.commandLine().usage(System.out);
    }
}
