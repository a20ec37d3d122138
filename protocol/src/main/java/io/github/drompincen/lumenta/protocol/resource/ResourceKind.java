package io.github.drompincen.lumenta.protocol.resource;

import java.util.Arrays;
import java.util.Optional;

/**
 * Resource kinds held by the store. {@code wire} is the ingestion/event type tag,
 * {@code segment} is the first path segment of the resource URI.
 */
public enum ResourceKind {
    DETECTION("detection", "detections"),
    IDENTITY_MATCH("identity_match", "identity-matches"),
    TRANSCRIPT("transcript", "transcripts"),
    SUMMARY("summary", "summaries"),
    WORKFLOW("workflow", "workflows"),
    TRACE("trace", "traces");

    private final String wire;
    private final String segment;

    ResourceKind(String wire, String segment) {
        this.wire = wire;
        this.segment = segment;
    }

    public String wire() {
        return wire;
    }

    public String segment() {
        return segment;
    }

    public static Optional<ResourceKind> fromWire(String value) {
        return Arrays.stream(values()).filter(k -> k.wire.equals(value)).findFirst();
    }

    public static Optional<ResourceKind> fromSegment(String value) {
        return Arrays.stream(values()).filter(k -> k.segment.equals(value)).findFirst();
    }
}
