package com.lad.dispatch.cli;

import com.lad.core.model.ReviewerOutcome;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the lad CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) LAD REVIEWER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [LAD]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void reviewer(ReviewerOutcome outcome) {
        String color = switch (outcome.status()) {
            case SUCCEEDED -> "fg(green)";
            case DISABLED -> "fg(white)";
            default -> "fg(red)";
        };
        String detail = outcome.errorDetail() != null ? ": " + outcome.errorDetail() : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) [" + outcome.role().displayName().toUpperCase() + "]|@ "
                        + "@|" + color + " " + outcome.status() + "|@ "
                        + outcome.modelId() + " (" + outcome.toolCalls().size() + " tool calls)" + detail));
    }
}
