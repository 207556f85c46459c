package com.lad.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for lad.
 * Routes to subcommands: design-review, code-review, health, serve.
 */
@Command(
        name = "lad",
        mixinStandardHelpOptions = true,
        version = "Lad Reviewer 0.1.0",
        description = "Dual-reviewer design and code reviews backed by two LLMs",
        subcommands = {
                DesignReviewCommand.class,
                CodeReviewCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class LadCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
