package io.github.drompincen.lumenta.protocol.push;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Frame pushed to real-time clients over SSE or WebSocket.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PushEnvelope(
        String type,
        Object data,
        String message,
        Instant timestamp
) {
    public static final String CONNECTED = "connected";
    public static final String HEARTBEAT = "heartbeat";

    public static PushEnvelope connected(String message) {
        return new PushEnvelope(CONNECTED, null, message, Instant.now());
    }

    public static PushEnvelope heartbeat() {
        return new PushEnvelope(HEARTBEAT, null, null, Instant.now());
    }

    public static PushEnvelope event(String type, Object data) {
        return new PushEnvelope(type, data, null, Instant.now());
    }
}
