package com.agentmanager.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree once the Spring context is up and hands its exit code to
 * {@link org.springframework.boot.SpringApplication#exit}.
 * <p>
 * {@code serve} is skipped here: the embedded web server keeps the JVM alive, and
 * {@link ServeCommand} prints its banner once Tomcat is ready.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final AgentManagerCommand agentManagerCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(AgentManagerCommand agentManagerCommand, IFactory factory) {
        this.agentManagerCommand = agentManagerCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return;
            }
        }
        exitCode = new CommandLine(agentManagerCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
