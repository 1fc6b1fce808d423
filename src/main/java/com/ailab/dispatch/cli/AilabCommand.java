package com.ailab.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command.
 * Routes to subcommands: serve, envs, reconcile, health, templates.
 */
@Command(
        name = "ailab",
        mixinStandardHelpOptions = true,
        version = "AI Lab Environment Manager 0.1.0",
        description = "Allocates, tracks and reconciles GPU workspace containers",
        subcommands = {
                ServeCommand.class,
                EnvsCommand.class,
                ReconcileCommand.class,
                HealthCommand.class,
                TemplatesCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AilabCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
