package com.agentmanager.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command. Routes to subcommands: serve, health, events.
 */
@Command(
        name = "agent-manager",
        mixinStandardHelpOptions = true,
        version = "Agent Manager 0.1.0",
        description = "Control plane for containerized coding-agent sessions",
        subcommands = {
                ServeCommand.class,
                HealthCommand.class,
                EventsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AgentManagerCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
