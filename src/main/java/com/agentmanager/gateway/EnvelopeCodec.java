package com.agentmanager.gateway;

import com.agentmanager.core.errors.ProtocolException;
import com.agentmanager.core.model.RepoStats;
import com.agentmanager.core.model.Session;
import com.agentmanager.core.model.SessionEvent;
import com.agentmanager.gateway.EnvelopePayload.Ack;
import com.agentmanager.gateway.EnvelopePayload.ClaudeMessage;
import com.agentmanager.gateway.EnvelopePayload.Command;
import com.agentmanager.gateway.EnvelopePayload.ErrorReply;
import com.agentmanager.gateway.EnvelopePayload.LoggedEvent;
import com.agentmanager.gateway.EnvelopePayload.RepoActivity;
import com.agentmanager.gateway.EnvelopePayload.RepoListSnapshot;
import com.agentmanager.gateway.EnvelopePayload.RepoSnapshot;
import com.agentmanager.gateway.EnvelopePayload.RunnerEvent;
import com.agentmanager.gateway.EnvelopePayload.SessionUpdated;
import com.agentmanager.gateway.EnvelopePayload.Snapshot;
import com.agentmanager.gateway.EnvelopePayload.Subscribe;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses and validates inbound frames, and renders outbound ones.
 *
 * <p>Inbound frames may arrive wrapped in a transport shell {@code {"type": ..., "data": <envelope>}};
 * the shell is removed before validation. Validation covers the protocol version, the kind,
 * the timestamp format, the seq and the minimal shape of each payload. Anything else in a
 * payload is passed through untouched.
 */
@Component
public class EnvelopeCodec {

    static final Pattern TIMESTAMP = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}\\.\\d{3}Z$");

    private static final DateTimeFormatter TS_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public EnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Envelope decode(String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw invalid("Frame is not valid JSON");
        }
        if (root == null || !root.isObject()) {
            throw invalid("Frame must be a JSON object");
        }
        root = unwrapShell(root);

        JsonNode v = root.get("v");
        if (v == null || !v.isIntegralNumber() || v.asInt() != Envelope.PROTOCOL_VERSION) {
            throw invalid("Unsupported protocol version: " + v);
        }

        JsonNode kindNode = root.get("kind");
        if (kindNode == null || !kindNode.isTextual()) {
            throw invalid("Missing kind");
        }
        EnvelopeKind kind = EnvelopeKind.fromWire(kindNode.asText())
                .orElseThrow(() -> new ProtocolException(ProtocolException.UNKNOWN_KIND,
                        "Unknown message kind: " + kindNode.asText()));

        JsonNode sessionNode = root.get("sessionId");
        String sessionId;
        if (sessionNode == null || sessionNode.isNull()) {
            sessionId = null;
        } else if (sessionNode.isTextual()) {
            sessionId = sessionNode.asText();
        } else {
            throw invalid("sessionId must be a string or null");
        }

        Instant ts = parseTimestamp(root.get("ts"));

        JsonNode seqNode = root.get("seq");
        if (seqNode == null || !seqNode.isIntegralNumber() || !seqNode.canConvertToLong() || seqNode.asLong() < 1) {
            throw invalid("seq must be a positive integer");
        }

        JsonNode payload = root.get("payload");
        if (payload == null || !payload.isObject()) {
            throw invalid("payload must be an object");
        }

        EnvelopePayload decoded = switch (kind) {
            case EVENT -> decodeEvent(payload);
            case COMMAND -> decodeCommand(payload);
            case SUBSCRIBE -> decodeSubscribe(payload);
            case ACK -> decodeAck(payload);
            case ERROR -> decodeError(payload);
            case SNAPSHOT -> throw new ProtocolException(ProtocolException.UNSUPPORTED_DIRECTION,
                    "snapshot frames are only sent by the server");
        };
        return new Envelope(Envelope.PROTOCOL_VERSION, kind, sessionId, ts, seqNode.asLong(), decoded);
    }

    public String encode(Envelope envelope) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("v", envelope.v());
        root.put("kind", envelope.kind().wireName());
        root.put("sessionId", envelope.sessionId());
        root.put("ts", formatTimestamp(envelope.ts()));
        root.put("seq", envelope.seq());
        root.set("payload", objectMapper.valueToTree(payloadView(envelope)));
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + envelope.kind().wireName() + " envelope", e);
        }
    }

    public static String formatTimestamp(Instant instant) {
        return instant == null ? null : TS_FORMAT.format(instant);
    }

    /** JSON-friendly view of a logged event, as clients receive it. */
    public static Map<String, Object> eventView(SessionEvent event) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", event.id());
        view.put("seq", event.seq());
        view.put("source", event.source().wireName());
        view.put("type", event.type());
        view.put("payload", event.payload());
        view.put("ts", formatTimestamp(event.ts()));
        return view;
    }

    public static Map<String, Object> sessionView(Session session) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", session.id());
        view.put("repoId", session.repoId());
        view.put("role", session.role().wireName());
        view.put("status", session.status().wireName());
        view.put("branchName", session.branchName());
        view.put("baseBranch", session.baseBranch());
        view.put("worktreePath", session.worktreePath());
        view.put("containerId", session.containerId());
        view.put("model", session.model());
        view.put("createdAt", formatTimestamp(session.createdAt()));
        view.put("updatedAt", formatTimestamp(session.updatedAt()));
        view.put("finishedAt", formatTimestamp(session.finishedAt()));
        view.put("lastKnownPrUrl", session.lastKnownPrUrl());
        return view;
    }

    public static Map<String, Object> repoView(RepoSummary summary) {
        RepoStats stats = summary.stats();
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", summary.repo().id());
        view.put("owner", summary.repo().owner());
        view.put("name", summary.repo().name());
        view.put("defaultBranch", summary.repo().defaultBranch());
        view.put("lastActivityAt", formatTimestamp(summary.repo().lastActivityAt()));
        view.put("totalSessions", stats.totalSessions());
        view.put("activeSessionCount", stats.activeSessions());
        view.put("hasRunning", stats.hasRunning());
        view.put("hasWaiting", stats.hasWaiting());
        view.put("hasError", stats.hasError());
        return view;
    }

    private Map<String, Object> payloadView(Envelope envelope) {
        Map<String, Object> view = new LinkedHashMap<>();
        switch (envelope.kind()) {
            case EVENT -> {
                if (envelope.payload() instanceof LoggedEvent logged) {
                    view.putAll(eventView(logged.event()));
                } else if (envelope.payload() instanceof RepoActivity activity) {
                    view.put("type", "repo.activity");
                    view.put("repo", repoView(activity.repo()));
                } else if (envelope.payload() instanceof SessionUpdated updated) {
                    view.put("type", "session.updated");
                    view.put("session", sessionView(updated.session()));
                } else if (envelope.payload() instanceof RunnerEvent runner) {
                    Map<String, Object> runnerEvent = new LinkedHashMap<>();
                    runnerEvent.put("type", runner.type().wireName());
                    runnerEvent.put("data", runner.data());
                    view.put("runnerEvent", runnerEvent);
                } else {
                    view.put("claudeMessage", ((ClaudeMessage) envelope.payload()).message());
                }
            }
            case COMMAND -> {
                Command command = (Command) envelope.payload();
                view.put("type", command.type().wireName());
                if (command.message() != null) {
                    view.put("message", command.message());
                }
                if (command.force()) {
                    view.put("force", true);
                }
                if (command.subscriptionId() != null) {
                    view.put("subscriptionId", command.subscriptionId());
                }
            }
            case SUBSCRIBE -> {
                Subscribe subscribe = (Subscribe) envelope.payload();
                view.put("target", subscribe.target().wireName());
                if (subscribe.repoId() != null) {
                    view.put("repoId", subscribe.repoId());
                }
                view.put("sinceSeq", subscribe.sinceSeq());
            }
            case SNAPSHOT -> {
                if (envelope.payload() instanceof RepoListSnapshot repos) {
                    view.put("subscriptionId", SubscribeTarget.REPO_LIST_SUBSCRIPTION);
                    view.put("type", "repos");
                    view.put("repos", repos.repos().stream().map(EnvelopeCodec::repoView).toList());
                } else if (envelope.payload() instanceof RepoSnapshot repo) {
                    view.put("subscriptionId", SubscribeTarget.repoSubscription(repo.repo().repo().id()));
                    view.put("type", "sessions");
                    view.put("repo", repoView(repo.repo()));
                    view.put("sessions", repo.sessions().stream().map(EnvelopeCodec::sessionView).toList());
                } else {
                    Snapshot snapshot = (Snapshot) envelope.payload();
                    view.put("subscriptionId", SubscribeTarget.sessionSubscription(snapshot.session().id()));
                    view.put("type", "events");
                    view.put("session", sessionView(snapshot.session()));
                    view.put("events", snapshot.events().stream().map(EnvelopeCodec::eventView).toList());
                    view.put("lastSeq", snapshot.lastSeq());
                }
            }
            case ACK -> {
                Ack ack = (Ack) envelope.payload();
                view.put("commandSeq", ack.commandSeq());
                view.put("success", ack.success());
                if (ack.data() != null && !ack.data().isEmpty()) {
                    view.put("data", ack.data());
                }
            }
            case ERROR -> {
                ErrorReply error = (ErrorReply) envelope.payload();
                view.put("code", error.code());
                view.put("message", error.message());
                if (error.details() != null && !error.details().isEmpty()) {
                    view.put("details", error.details());
                }
            }
        }
        return view;
    }

    /**
     * Some transports wrap the envelope as {@code {"type": "...", "data": {...}}}.
     */
    private static JsonNode unwrapShell(JsonNode root) {
        JsonNode data = root.get("data");
        if (!root.has("kind") && root.has("type") && data != null && data.isObject()) {
            return data;
        }
        return root;
    }

    private static Instant parseTimestamp(JsonNode tsNode) {
        if (tsNode == null || !tsNode.isTextual() || !TIMESTAMP.matcher(tsNode.asText()).matches()) {
            throw invalid("ts must be an ISO-8601 UTC timestamp with millisecond precision");
        }
        try {
            return Instant.parse(tsNode.asText());
        } catch (DateTimeParseException e) {
            throw invalid("ts is not a valid instant: " + tsNode.asText());
        }
    }

    private EnvelopePayload decodeEvent(JsonNode payload) {
        JsonNode claudeMessage = payload.get("claudeMessage");
        if (claudeMessage != null && claudeMessage.isObject()) {
            return new ClaudeMessage(toMap(claudeMessage));
        }
        JsonNode runnerEvent = payload.get("runnerEvent");
        if (runnerEvent == null || !runnerEvent.isObject()) {
            throw invalid("event payload must contain claudeMessage or runnerEvent");
        }
        JsonNode typeNode = runnerEvent.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw invalid("runnerEvent.type is required");
        }
        RunnerEventType type = RunnerEventType.fromWire(typeNode.asText())
                .orElseThrow(() -> invalid("Unknown runner event type: " + typeNode.asText()));
        JsonNode data = runnerEvent.get("data");
        if (data != null && !data.isNull() && !data.isObject()) {
            throw invalid("runnerEvent.data must be an object");
        }
        Map<String, Object> dataMap = data == null || data.isNull() ? Map.of() : toMap(data);
        for (String field : type.requiredFields()) {
            if (!dataMap.containsKey(field)) {
                throw invalid(type.wireName() + " requires data." + field);
            }
        }
        return new RunnerEvent(type, dataMap);
    }

    private EnvelopePayload decodeCommand(JsonNode payload) {
        JsonNode typeNode = payload.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw invalid("command type is required");
        }
        CommandType type = CommandType.fromWire(typeNode.asText())
                .orElseThrow(() -> invalid("Unknown command type: " + typeNode.asText()));
        if (type == CommandType.UNSUBSCRIBE) {
            String subscriptionId = text(payload, "subscriptionId");
            if (subscriptionId == null || subscriptionId.isBlank()) {
                throw invalid("unsubscribe requires a subscriptionId");
            }
            return new Command(type, null, false, subscriptionId);
        }
        String message = text(payload, "message");
        if (type == CommandType.USER_MESSAGE && (message == null || message.isBlank())) {
            throw invalid("user_message requires a non-empty message");
        }
        boolean force = payload.path("force").asBoolean(false);
        return Command.of(type, message, force);
    }

    private EnvelopePayload decodeSubscribe(JsonNode payload) {
        JsonNode targetNode = payload.get("target");
        SubscribeTarget target = SubscribeTarget.SESSION;
        if (targetNode != null && !targetNode.isNull()) {
            if (!targetNode.isTextual()) {
                throw invalid("target must be a string");
            }
            target = SubscribeTarget.fromWire(targetNode.asText())
                    .orElseThrow(() -> invalid("Unknown subscribe target: " + targetNode.asText()));
        }
        String repoId = text(payload, "repoId");
        if (target == SubscribeTarget.REPO && (repoId == null || repoId.isBlank())) {
            throw invalid("a repo subscription requires repoId");
        }
        JsonNode since = payload.get("sinceSeq");
        if (since == null || since.isNull()) {
            return new Subscribe(target, repoId, 0);
        }
        if (!since.isIntegralNumber() || since.asLong() < 0) {
            throw invalid("sinceSeq must be a non-negative integer");
        }
        return new Subscribe(target, repoId, since.asLong());
    }

    private EnvelopePayload decodeAck(JsonNode payload) {
        JsonNode commandSeq = payload.get("commandSeq");
        JsonNode success = payload.get("success");
        if (commandSeq == null || !commandSeq.isIntegralNumber() || success == null || !success.isBoolean()) {
            throw invalid("ack requires commandSeq and success");
        }
        JsonNode data = payload.get("data");
        return new Ack(commandSeq.asLong(), success.asBoolean(),
                data != null && data.isObject() ? toMap(data) : Map.of());
    }

    private EnvelopePayload decodeError(JsonNode payload) {
        JsonNode code = payload.get("code");
        JsonNode message = payload.get("message");
        if (code == null || !code.isTextual() || message == null || !message.isTextual()) {
            throw invalid("error requires code and message");
        }
        JsonNode details = payload.get("details");
        return new ErrorReply(code.asText(), message.asText(),
                details != null && details.isObject() ? toMap(details) : Map.of());
    }

    private static String text(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }

    private Map<String, Object> toMap(JsonNode node) {
        return objectMapper.convertValue(node, MAP_TYPE);
    }

    private static ProtocolException invalid(String message) {
        return new ProtocolException(ProtocolException.INVALID_MESSAGE, message);
    }
}
