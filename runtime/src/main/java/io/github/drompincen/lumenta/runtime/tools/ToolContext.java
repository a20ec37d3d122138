package io.github.drompincen.lumenta.runtime.tools;

/**
 * Per-call context. {@code integrationId} is set when the call was routed through an integration.
 */
public record ToolContext(
        String callId,
        ToolCallOrigin origin,
        String integrationId
) {
    public static ToolContext of(String callId, ToolCallOrigin origin) {
        return new ToolContext(callId, origin, null);
    }
}
