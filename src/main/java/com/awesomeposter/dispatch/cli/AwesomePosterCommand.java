package com.awesomeposter.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 * Routes to subcommands: run, thread, serve.
 */
@Command(
        name = "awesomeposter",
        mixinStandardHelpOptions = true,
        version = "AwesomePoster orchestrator 0.1.0",
        description = "Plan-driven content generation with human-in-the-loop pauses",
        subcommands = {
                RunCommand.class,
                ThreadCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AwesomePosterCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
