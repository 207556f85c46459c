package com.lad.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: lad serve
 * <p>
 * Exposes {@code POST /api/v1/reviews/design}, {@code POST /api/v1/reviews/code} and
 * {@code GET /api/v1/health}. The launcher starts the web server when {@code serve} is the
 * first argument and never hands it to picocli; this command only runs when {@code serve}
 * appears later on the command line, which is rejected.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 lad serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the review HTTP server (must be the first argument)")
@Component
public class ServeCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        ConsoleOutput.error("'serve' must be the first argument: lad serve");
        return 2;
    }
}
