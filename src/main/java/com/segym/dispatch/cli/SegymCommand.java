package com.segym.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for SE-Gym.
 * Routes to subcommands: run, baseline.
 */
@Command(
        name = "segym",
        mixinStandardHelpOptions = true,
        version = "SE-Gym 0.1.0",
        description = "Evolves LLM repair prompts against a project's test suite",
        subcommands = {
                RunCommand.class,
                BaselineCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SegymCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
