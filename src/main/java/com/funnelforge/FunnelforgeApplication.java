package com.funnelforge;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

import java.util.Arrays;

@SpringBootApplication
public class FunnelforgeApplication {

    public static void main(String[] args) {
        boolean serveMode = isServeMode(args);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(FunnelforgeApplication.class);

        if (serveMode) {
            builder.properties(
                    "spring.main.web-application-type=servlet",
                    "spring.main.banner-mode=off"
            );
        } else {
            // CLI-only: no web server, commands drive the orchestrator themselves
            builder.properties(
                    "spring.main.web-application-type=none",
                    "spring.main.banner-mode=off",
                    "funnel.scheduler.enabled=false"
            );
        }

        ApplicationContext ctx = builder.run(args);

        if (!serveMode) {
            ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
            int exitCode = SpringApplication.exit(ctx, exitCodeGen);
            System.exit(exitCode);
        }
    }

    /** True when the arguments ask for the long-running HTTP server. */
    public static boolean isServeMode(String... args) {
        return Arrays.asList(args).contains("serve");
    }
}
