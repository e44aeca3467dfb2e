package com.funnelforge.dispatch.cli;

import com.funnelforge.FunnelforgeApplication;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree once the Spring context is up and hands its exit code back
 * to {@link FunnelforgeApplication#main}. In serve mode nothing is executed: the embedded
 * server keeps the JVM alive and {@link ServeCommand} prints its banner when Tomcat is ready.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final FunnelCommand funnelCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(FunnelCommand funnelCommand, IFactory factory) {
        this.funnelCommand = funnelCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (FunnelforgeApplication.isServeMode(args)) {
            log.debug("Serve mode: skipping CLI dispatch");
            return;
        }
        exitCode = new CommandLine(funnelCommand, factory).execute(args);
        if (exitCode != 0) {
            log.debug("Command {} exited with {}", String.join(" ", args), exitCode);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
