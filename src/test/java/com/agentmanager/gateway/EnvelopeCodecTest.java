package com.agentmanager.gateway;

import com.agentmanager.core.errors.ProtocolException;
import com.agentmanager.core.model.EventSource;
import com.agentmanager.core.model.Repo;
import com.agentmanager.core.model.RepoStats;
import com.agentmanager.core.model.SessionEvent;
import com.agentmanager.gateway.EnvelopePayload.Ack;
import com.agentmanager.gateway.EnvelopePayload.ClaudeMessage;
import com.agentmanager.gateway.EnvelopePayload.Command;
import com.agentmanager.gateway.EnvelopePayload.LoggedEvent;
import com.agentmanager.gateway.EnvelopePayload.RepoListSnapshot;
import com.agentmanager.gateway.EnvelopePayload.RunnerEvent;
import com.agentmanager.gateway.EnvelopePayload.Subscribe;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final EnvelopeCodec codec = new EnvelopeCodec(objectMapper);

    private static String frame(String kind, String sessionId, long seq, String payload) {
        return """
                {"v":1,"kind":"%s","sessionId":%s,"ts":"2026-03-01T10:00:00.000Z","seq":%d,"payload":%s}
                """.formatted(kind, sessionId == null ? "null" : "\"" + sessionId + "\"", seq, payload);
    }

    private static String code(Runnable decode) {
        return assertThrows(ProtocolException.class, decode::run).code();
    }

    @Nested
    @DisplayName("decode")
    class DecodeTests {

        @Test
        @DisplayName("runner events keep their type and data")
        void runnerEvent() {
            Envelope envelope = codec.decode(frame("event", "s-1", 3,
                    "{\"runnerEvent\":{\"type\":\"process.exited\",\"data\":{\"exitCode\":1,\"signal\":null,\"reason\":\"crash\"}}}"));

            assertEquals(EnvelopeKind.EVENT, envelope.kind());
            assertEquals("s-1", envelope.sessionId());
            assertEquals(3, envelope.seq());
            assertEquals(Instant.parse("2026-03-01T10:00:00Z"), envelope.ts());
            RunnerEvent event = (RunnerEvent) envelope.payload();
            assertEquals(RunnerEventType.PROCESS_EXITED, event.type());
            assertEquals(1, event.data().get("exitCode"));
            assertTrue(event.data().containsKey("signal"));
        }

        @Test
        @DisplayName("claude messages pass through untouched")
        void claudeMessage() {
            Envelope envelope = codec.decode(frame("event", "s-1", 1,
                    "{\"claudeMessage\":{\"type\":\"assistant\",\"message\":{\"content\":[{\"type\":\"text\",\"text\":\"hi\"}]}}}"));

            ClaudeMessage message = (ClaudeMessage) envelope.payload();
            assertEquals("assistant", message.messageType());
            assertTrue(message.message().containsKey("message"));
        }

        @Test
        @DisplayName("commands, subscribe and ack decode to their payloads")
        void otherKinds() {
            Command command = (Command) codec.decode(frame("command", "s-1", 1,
                    "{\"type\":\"user_message\",\"message\":\"carry on\",\"force\":true}")).payload();
            assertEquals(CommandType.USER_MESSAGE, command.type());
            assertEquals("carry on", command.message());
            assertTrue(command.force());

            Subscribe subscribe = (Subscribe) codec.decode(frame("subscribe", "s-1", 2, "{}")).payload();
            assertEquals(SubscribeTarget.SESSION, subscribe.target());
            assertEquals(0, subscribe.sinceSeq());

            Ack ack = (Ack) codec.decode(frame("ack", "s-1", 3, "{\"commandSeq\":7,\"success\":true}")).payload();
            assertEquals(7, ack.commandSeq());
        }

        @Test
        @DisplayName("repo subscriptions and unsubscribe need no session")
        void repoTargets() {
            Subscribe list = (Subscribe) codec.decode(frame("subscribe", null, 1, "{\"target\":\"repo_list\"}")).payload();
            assertEquals(SubscribeTarget.REPO_LIST, list.target());

            Subscribe repo = (Subscribe) codec.decode(frame("subscribe", null, 2,
                    "{\"target\":\"repo\",\"repoId\":\"r-1\"}")).payload();
            assertEquals(SubscribeTarget.REPO, repo.target());
            assertEquals("r-1", repo.repoId());

            Command unsubscribe = (Command) codec.decode(frame("command", null, 3,
                    "{\"type\":\"unsubscribe\",\"subscriptionId\":\"repo:r-1\"}")).payload();
            assertEquals(CommandType.UNSUBSCRIBE, unsubscribe.type());
            assertEquals("repo:r-1", unsubscribe.subscriptionId());

            assertEquals(ProtocolException.INVALID_MESSAGE,
                    code(() -> codec.decode(frame("subscribe", null, 1, "{\"target\":\"repo\"}"))));
            assertEquals(ProtocolException.INVALID_MESSAGE,
                    code(() -> codec.decode(frame("subscribe", null, 1, "{\"target\":\"everything\"}"))));
            assertEquals(ProtocolException.INVALID_MESSAGE,
                    code(() -> codec.decode(frame("command", null, 1, "{\"type\":\"unsubscribe\"}"))));
        }

        @Test
        @DisplayName("the {type, data} transport shell is removed")
        void unwrapsShell() {
            String inner = frame("subscribe", "s-1", 1, "{\"sinceSeq\":4}").trim();
            Envelope envelope = codec.decode("{\"type\":\"envelope\",\"data\":" + inner + "}");

            assertEquals(4, ((Subscribe) envelope.payload()).sinceSeq());
        }

        @Test
        @DisplayName("malformed frames are rejected as INVALID_MESSAGE")
        void invalidFrames() {
            assertEquals(ProtocolException.INVALID_MESSAGE, code(() -> codec.decode("not json")));
            assertEquals(ProtocolException.INVALID_MESSAGE, code(() -> codec.decode("[1,2]")));
            assertEquals(ProtocolException.INVALID_MESSAGE,
                    code(() -> codec.decode(frame("event", "s-1", 1, "{}").replace("\"v\":1", "\"v\":2"))));
            assertEquals(ProtocolException.INVALID_MESSAGE,
                    code(() -> codec.decode(frame("subscribe", "s-1", 0, "{}"))));
            assertEquals(ProtocolException.INVALID_MESSAGE,
                    code(() -> codec.decode(frame("subscribe", "s-1", 1, "{}")
                            .replace("2026-03-01T10:00:00.000Z", "2026-03-01T10:00:00Z"))));
            assertEquals(ProtocolException.INVALID_MESSAGE,
                    code(() -> codec.decode(frame("subscribe", "s-1", 1, "[]"))));
        }

        @Test
        @DisplayName("runner events missing required data fields are rejected")
        void missingRequiredFields() {
            assertEquals(ProtocolException.INVALID_MESSAGE, code(() -> codec.decode(frame("event", "s-1", 1,
                    "{\"runnerEvent\":{\"type\":\"process.started\",\"data\":{\"sessionId\":\"s-1\"}}}"))));
            assertEquals(ProtocolException.INVALID_MESSAGE, code(() -> codec.decode(frame("event", "s-1", 1,
                    "{\"runnerEvent\":{\"type\":\"process.teleported\",\"data\":{}}}"))));
            assertEquals(ProtocolException.INVALID_MESSAGE, code(() -> codec.decode(frame("command", "s-1", 1,
                    "{\"type\":\"user_message\",\"message\":\"\"}"))));
        }

        @Test
        @DisplayName("unknown kinds and client-sent snapshots get their own codes")
        void kinds() {
            assertEquals(ProtocolException.UNKNOWN_KIND, code(() -> codec.decode(frame("telemetry", "s-1", 1, "{}"))));
            assertEquals(ProtocolException.UNSUPPORTED_DIRECTION,
                    code(() -> codec.decode(frame("snapshot", "s-1", 1, "{}"))));
        }
    }

    @Nested
    @DisplayName("encode")
    class EncodeTests {

        @Test
        @DisplayName("logged events are rendered with their log seq and millisecond timestamps")
        void loggedEvent() throws Exception {
            Instant ts = Instant.parse("2026-03-01T10:00:01.234567Z");
            var event = new SessionEvent(11, "s-1", EventSource.AGENT, "session.idle", Map.of(), 5, ts);

            JsonNode json = objectMapper.readTree(codec.encode(
                    Envelope.of(EnvelopeKind.EVENT, "s-1", 5, new LoggedEvent(event), ts)));

            assertEquals(1, json.get("v").asInt());
            assertEquals("event", json.get("kind").asText());
            assertEquals(5, json.get("seq").asLong());
            assertEquals("2026-03-01T10:00:01.234Z", json.get("ts").asText());
            assertEquals("session.idle", json.at("/payload/type").asText());
            assertEquals("agent", json.at("/payload/source").asText());
            assertEquals(5, json.at("/payload/seq").asLong());
        }

        @Test
        @DisplayName("repo list snapshots carry their subscription id and per-repo stats")
        void repoListSnapshot() throws Exception {
            Instant ts = Instant.parse("2026-03-01T10:00:00Z");
            var repo = new Repo("r-1", "acme", "widgets", "main", ts, ts, ts);
            var snapshot = new RepoListSnapshot(List.of(new RepoSummary(repo, new RepoStats(3, 1, false, true, true))));

            JsonNode json = objectMapper.readTree(codec.encode(Envelope.of(EnvelopeKind.SNAPSHOT, null, 2, snapshot, ts)));

            assertEquals("repos", json.at("/payload/type").asText());
            assertEquals("repo_list", json.at("/payload/subscriptionId").asText());
            assertEquals("widgets", json.at("/payload/repos/0/name").asText());
            assertEquals(3, json.at("/payload/repos/0/totalSessions").asInt());
            assertEquals(1, json.at("/payload/repos/0/activeSessionCount").asInt());
            assertTrue(json.at("/payload/repos/0/hasWaiting").asBoolean());
            assertEquals("2026-03-01T10:00:00.000Z", json.at("/payload/repos/0/lastActivityAt").asText());
        }

        @Test
        @DisplayName("encoded commands decode to the same command")
        void commandRoundTrip() {
            var command = Command.of(CommandType.STOP, null, false);
            String text = codec.encode(Envelope.of(EnvelopeKind.COMMAND, "s-1", 9, command, Instant.now()));

            Envelope decoded = codec.decode(text);

            assertEquals(command, decoded.payload());
            assertEquals(9, decoded.seq());
        }
    }
}
