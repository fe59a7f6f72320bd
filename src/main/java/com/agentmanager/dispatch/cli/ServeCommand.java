package com.agentmanager.dispatch.cli;

import com.agentmanager.gateway.GatewayProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: agent-manager serve
 * <p>
 * Runs the REST API and the WebSocket gateway until interrupted. The web server itself is
 * enabled by {@link com.agentmanager.AgentManagerApplication#main} seeing "serve" in the
 * arguments; the banner is printed once Tomcat is ready.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the REST API and WebSocket gateway")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    private final GatewayProperties gatewayProperties;

    public ServeCommand(GatewayProperties gatewayProperties) {
        this.gatewayProperties = gatewayProperties;
    }

    @Override
    public void run() {
        // Only reached for --help style invocations; CliRunner skips picocli in serve mode.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Agent manager running on port " + port);
        System.out.println();
        System.out.println("  API:        http://localhost:" + port + "/api");
        System.out.println("  Gateway:    ws://localhost:" + port + gatewayProperties.getPath());
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
