package com.agentmanager.dispatch.cli;

import com.agentmanager.core.events.SessionEventRecorder;
import com.agentmanager.core.model.Session;
import com.agentmanager.core.model.SessionEvent;
import com.agentmanager.core.persistence.SessionStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: agent-manager events &lt;session-id&gt;
 * <p>
 * Prints a session's event log in seq order. Useful for postmortems: every failure is in
 * there as a {@code session.error} event with the phase that failed.
 */
@Command(name = "events", mixinStandardHelpOptions = true, description = "Show a session's event log")
@Component
public class EventsCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Session ID")
    private String sessionId;

    @Option(names = {"--after", "-a"}, description = "Only events with seq greater than this", defaultValue = "0")
    private long after;

    @Option(names = {"--limit", "-n"}, description = "Maximum number of events", defaultValue = "200")
    private int limit;

    private final SessionStore sessionStore;
    private final SessionEventRecorder recorder;

    public EventsCommand(SessionStore sessionStore, SessionEventRecorder recorder) {
        this.sessionStore = sessionStore;
        this.recorder = recorder;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Optional<Session> session = sessionStore.findById(sessionId);
        if (session.isEmpty()) {
            ConsoleOutput.error("Session not found: " + sessionId);
            return 1;
        }
        Session s = session.get();
        ConsoleOutput.info("Session " + s.id() + " (" + s.role().wireName() + ", " + s.status().wireName() + ")");
        if (s.branchName() != null) {
            System.out.println("  Branch: " + s.branchName());
        }
        System.out.println();

        List<SessionEvent> events = recorder.history(sessionId, after, limit);
        if (events.isEmpty()) {
            ConsoleOutput.info("No events.");
            return 0;
        }
        events.forEach(ConsoleOutput::event);
        return 0;
    }
}
