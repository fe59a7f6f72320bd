package com.agentmanager.dispatch.cli;

import com.agentmanager.core.model.SessionEvent;
import picocli.CommandLine;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * ANSI-colored terminal output utilities for the agent-manager CLI.
 */
public class ConsoleOutput {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneOffset.UTC);

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AGENT MANAGER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [AGENT-MANAGER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void event(SessionEvent event) {
        // payload is printed raw so agent output cannot inject markup
        String label = CommandLine.Help.Ansi.AUTO.string(eventLabel(event));
        System.out.printf("  %5d %s %s %s%n", event.seq(), TIME.format(event.ts()), label,
                event.payload().isEmpty() ? "" : event.payload());
    }

    static String eventLabel(SessionEvent event) {
        String type = event.type();
        if ("session.error".equals(type)) {
            return "@|fg(red),bold [" + type + "]|@";
        }
        if (type.startsWith("session.")) {
            return "@|fg(green) [" + type + "]|@";
        }
        if (type.startsWith("user.")) {
            return "@|fg(magenta) [" + type + "]|@";
        }
        if (type.startsWith("claude.")) {
            return "@|fg(blue) [" + type + "]|@";
        }
        return "@|fg(white) [" + type + "]|@";
    }
}
