package com.marketpulse.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for MarketPulse.
 * Routes to subcommands: analyze, checkpoints, providers, health, serve.
 */
@Command(
        name = "marketpulse",
        mixinStandardHelpOptions = true,
        version = "MarketPulse 0.1.0",
        description = "Staged market analysis with quality gates and provider fallback",
        subcommands = {
                AnalyzeCommand.class,
                CheckpointsCommand.class,
                ProvidersCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class MarketPulseCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // Reuse the factory-built instance; subcommands have no no-arg constructors.
        spec.commandLine().usage(System.out);
    }
}
