package com.agentmanager.core.events;

import com.agentmanager.core.metrics.AgentManagerMetrics;
import com.agentmanager.core.model.EventSource;
import com.agentmanager.core.model.SessionEvent;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * The single write path into the event log.
 * <p>
 * Appends and subscriptions for a session share one lock: an append is persisted and then
 * published while the lock is held, and a subscriber reads its replay and registers for live
 * events under the same lock. A subscriber therefore sees every event after its
 * {@code sinceSeq} exactly once, in seq order, whether it arrives in the replay or live.
 * <p>
 * Locks are striped by session id: a session always maps to the same lock, and the number of
 * locks stays fixed however many sessions the process sees.
 */
@Service
public class SessionEventRecorder {

    static final int LOCK_STRIPES = 64;

    private final EventLog eventLog;
    private final EventBus eventBus;
    private final AgentManagerMetrics metrics;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public SessionEventRecorder(EventLog eventLog, EventBus eventBus, AgentManagerMetrics metrics) {
        this.eventLog = eventLog;
        this.eventBus = eventBus;
        this.metrics = metrics;
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public SessionEvent record(String sessionId, EventSource source, String type, Map<String, Object> payload) {
        ReentrantLock lock = lockFor(sessionId);
        lock.lock();
        try {
            SessionEvent event = eventLog.append(sessionId, source, type, payload);
            metrics.recordEventAppended(source);
            eventBus.publish(event);
            return event;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hands {@code onReplay} every event with seq greater than {@code sinceSeq}, then registers
     * {@code listener} for everything appended afterwards. Both happen before any concurrent
     * append can interleave.
     */
    public EventBus.Subscription subscribe(String sessionId, long sinceSeq,
                                           Consumer<Replay> onReplay, Consumer<SessionEvent> listener) {
        ReentrantLock lock = lockFor(sessionId);
        lock.lock();
        try {
            List<SessionEvent> events = eventLog.query(sessionId, sinceSeq);
            long lastSeq = events.isEmpty() ? eventLog.lastSeq(sessionId) : events.get(events.size() - 1).seq();
            onReplay.accept(new Replay(events, lastSeq));
            return eventBus.subscribe(sessionId, listener);
        } finally {
            lock.unlock();
        }
    }

    public List<SessionEvent> history(String sessionId, long sinceSeq, int limit) {
        return eventLog.query(sessionId, sinceSeq, limit);
    }

    ReentrantLock lockFor(String sessionId) {
        return locks[Math.floorMod(sessionId.hashCode(), locks.length)];
    }

    /**
     * Events replayed to a new subscriber and the seq live delivery continues after.
     */
    public record Replay(List<SessionEvent> events, long lastSeq) {}
}
