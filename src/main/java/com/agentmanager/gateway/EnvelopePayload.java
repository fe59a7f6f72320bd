package com.agentmanager.gateway;

import com.agentmanager.core.model.Session;
import com.agentmanager.core.model.SessionEvent;

import java.util.List;
import java.util.Map;

/**
 * Typed payload of an {@link Envelope}. Which variant an envelope carries follows from its
 * {@link EnvelopeKind}.
 */
public sealed interface EnvelopePayload {

    /** What an agent may send in an {@code event} frame. */
    sealed interface AgentEvent extends EnvelopePayload {}

    /**
     * Raw Claude CLI stream-json output, passed through untouched.
     */
    record ClaudeMessage(Map<String, Object> message) implements AgentEvent {

        public String messageType() {
            Object type = message.get("type");
            return type instanceof String s && !s.isBlank() ? s : "message";
        }
    }

    record RunnerEvent(RunnerEventType type, Map<String, Object> data) implements AgentEvent {}

    /** An event from the log, on its way to a subscribed client. */
    record LoggedEvent(SessionEvent event) implements EnvelopePayload {}

    /** Gateway to a repo list subscriber: a repo's stats changed. */
    record RepoActivity(RepoSummary repo) implements EnvelopePayload {}

    /** Gateway to a repo subscriber: one of the repo's sessions changed. */
    record SessionUpdated(Session session) implements EnvelopePayload {}

    /**
     * {@code subscriptionId} is only set for {@link CommandType#UNSUBSCRIBE}.
     */
    record Command(CommandType type, String message, boolean force, String subscriptionId) implements EnvelopePayload {

        public static Command of(CommandType type, String message, boolean force) {
            return new Command(type, message, force, null);
        }
    }

    /**
     * {@code repoId} is set for {@link SubscribeTarget#REPO}; {@code sinceSeq} applies to
     * {@link SubscribeTarget#SESSION}.
     */
    record Subscribe(SubscribeTarget target, String repoId, long sinceSeq) implements EnvelopePayload {}

    record Snapshot(Session session, List<SessionEvent> events, long lastSeq) implements EnvelopePayload {}

    record RepoListSnapshot(List<RepoSummary> repos) implements EnvelopePayload {}

    record RepoSnapshot(RepoSummary repo, List<Session> sessions) implements EnvelopePayload {}

    record Ack(long commandSeq, boolean success, Map<String, Object> data) implements EnvelopePayload {}

    record ErrorReply(String code, String message, Map<String, Object> details) implements EnvelopePayload {}
}
