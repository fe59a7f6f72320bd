package com.agentmanager.core.events;

import com.agentmanager.core.model.EventSource;
import com.agentmanager.core.model.SessionEvent;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link EventLog} held in memory; events are lost on restart.
 */
public class InMemoryEventLog implements EventLog {

    private final ConcurrentHashMap<String, List<SessionEvent>> eventsBySession = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final Clock clock;

    public InMemoryEventLog(Clock clock) {
        this.clock = clock;
    }

    @Override
    public SessionEvent append(String sessionId, EventSource source, String type, Map<String, Object> payload) {
        List<SessionEvent> events = eventsBySession.computeIfAbsent(sessionId, k -> new ArrayList<>());
        synchronized (events) {
            SessionEvent event = new SessionEvent(ids.incrementAndGet(), sessionId, source, type,
                    payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload)), events.size() + 1L, clock.instant());
            events.add(event);
            return event;
        }
    }

    @Override
    public List<SessionEvent> query(String sessionId, long sinceSeq) {
        List<SessionEvent> events = eventsBySession.get(sessionId);
        if (events == null) {
            return List.of();
        }
        synchronized (events) {
            // seq n sits at index n - 1
            int from = (int) Math.min(Math.max(sinceSeq, 0), events.size());
            return List.copyOf(events.subList(from, events.size()));
        }
    }

    @Override
    public long lastSeq(String sessionId) {
        List<SessionEvent> events = eventsBySession.get(sessionId);
        if (events == null) {
            return 0;
        }
        synchronized (events) {
            return events.size();
        }
    }
}
