package com.lad.dispatch.cli;

import com.lad.LadApplication;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree once the Spring context is up and reports its exit code
 * to {@link org.springframework.boot.SpringApplication#exit}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final LadCommand ladCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(LadCommand ladCommand, IFactory factory) {
        this.ladCommand = ladCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (LadApplication.isServeMode(args)) {
            // the embedded web server owns the process
            return;
        }
        exitCode = new CommandLine(ladCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
