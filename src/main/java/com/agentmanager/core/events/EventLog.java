package com.agentmanager.core.events;

import com.agentmanager.core.model.EventSource;
import com.agentmanager.core.model.SessionEvent;

import java.util.List;
import java.util.Map;

/**
 * Durable, per-session, append-only record of everything that happened to a session.
 * <p>
 * The log is the only source of sequence numbers: for each session they start at 1 and
 * are strictly increasing, gapless and unique, even under concurrent appends.
 */
public interface EventLog {

    SessionEvent append(String sessionId, EventSource source, String type, Map<String, Object> payload);

    /**
     * Returns every event of the session with {@code seq > sinceSeq}, in ascending seq order.
     */
    List<SessionEvent> query(String sessionId, long sinceSeq);

    /**
     * Like {@link #query(String, long)} but returns at most {@code limit} events.
     */
    default List<SessionEvent> query(String sessionId, long sinceSeq, int limit) {
        List<SessionEvent> all = query(sessionId, sinceSeq);
        return all.size() <= limit ? all : all.subList(0, limit);
    }

    /** Highest seq assigned so far for the session, or 0 if it has no events. */
    long lastSeq(String sessionId);
}
