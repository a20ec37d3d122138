package io.github.drompincen.lumenta.protocol.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One content block of a tool result: either inline text or a resource URI.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolContent(
        String type,
        String text,
        String resource
) {
    public static ToolContent text(String text) {
        return new ToolContent("text", text, null);
    }

    public static ToolContent resource(String uri) {
        return new ToolContent("resource", null, uri);
    }
}
