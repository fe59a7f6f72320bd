package com.agentmanager.core.events;

import com.agentmanager.core.model.SessionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for logged session events.
 * <p>
 * Supports per-session subscriptions and global subscriptions that receive all events.
 * Events reach the bus only after the {@link EventLog} has assigned their seq, and only
 * through {@link SessionEventRecorder}, which publishes in seq order.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-session subscribers keyed by sessionId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<SessionEvent>>> sessionSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all sessions. */
    private final CopyOnWriteArrayList<Consumer<SessionEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers (session-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(SessionEvent event) {
        log.debug("Publishing event: {} #{} for session {}", event.type(), event.seq(), event.sessionId());

        List<Consumer<SessionEvent>> sessionSubs = sessionSubscribers.get(event.sessionId());
        if (sessionSubs != null) {
            for (Consumer<SessionEvent> subscriber : sessionSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<SessionEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific session.
     *
     * @param sessionId the session to subscribe to
     * @param consumer  callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String sessionId, Consumer<SessionEvent> consumer) {
        // add and remove go through compute so an emptied list is never reused after removal
        sessionSubscribers.compute(sessionId, (k, subs) -> {
            CopyOnWriteArrayList<Consumer<SessionEvent>> list = subs != null ? subs : new CopyOnWriteArrayList<>();
            list.add(consumer);
            return list;
        });
        log.debug("Subscribed to session {}", sessionId);
        return () -> sessionSubscribers.computeIfPresent(sessionId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    /**
     * Subscribe to events from all sessions (global subscription).
     *
     * @param consumer callback invoked for each event regardless of session
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<SessionEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    public int subscriberCount(String sessionId) {
        List<Consumer<SessionEvent>> subs = sessionSubscribers.get(sessionId);
        return subs == null ? 0 : subs.size();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<SessionEvent> subscriber, SessionEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.type(), e.getMessage(), e);
        }
    }
}
