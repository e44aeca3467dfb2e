package com.funnelforge.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Funnelforge.
 * Routes to subcommands: serve, simulate, health.
 */
@Command(
        name = "funnelforge",
        mixinStandardHelpOptions = true,
        version = "Funnelforge 0.1.0",
        description = "Profit-optimizing decision engine for a content-marketing funnel",
        subcommands = {
                ServeCommand.class,
                SimulateCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class FunnelCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
