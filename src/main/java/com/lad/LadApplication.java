package com.lad;

import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class LadApplication {

    public static void main(String[] args) {
        boolean serveMode = isServeMode(args);

        ConfigurableApplicationContext ctx = new SpringApplicationBuilder(LadApplication.class)
                .web(serveMode ? WebApplicationType.SERVLET : WebApplicationType.NONE)
                .bannerMode(Banner.Mode.OFF)
                .run(args);

        if (!serveMode) {
            // one-shot CLI: exit code comes from CliRunner
            System.exit(SpringApplication.exit(ctx));
        }
    }

    /**
     * Serve mode is selected only by {@code serve} as the subcommand, so an option value
     * such as {@code --code serve} does not start the web server.
     */
    public static boolean isServeMode(String... args) {
        return args.length > 0 && "serve".equals(args[0]);
    }
}
