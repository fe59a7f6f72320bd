package com.agentmanager.gateway;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * One WebSocket frame: {@code {v, kind, sessionId, ts, seq, payload}}.
 * <p>
 * {@code seq} is the log-assigned sequence number for {@code event} and {@code command}
 * frames the gateway sends; on inbound frames it is the sender's own counter.
 */
public record Envelope(
        int v,
        EnvelopeKind kind,
        String sessionId,
        Instant ts,
        long seq,
        EnvelopePayload payload
) {

    public static final int PROTOCOL_VERSION = 1;

    public Envelope {
        ts = ts.truncatedTo(ChronoUnit.MILLIS);
    }

    public static Envelope of(EnvelopeKind kind, String sessionId, long seq, EnvelopePayload payload, Instant now) {
        return new Envelope(PROTOCOL_VERSION, kind, sessionId, now, seq, payload);
    }
}
