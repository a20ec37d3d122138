package io.github.drompincen.lumenta.runtime.tools;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.lumenta.protocol.mcp.ToolContent;

import java.util.List;

/**
 * MCP tool result: content blocks plus an {@code isError} flag, omitted when false.
 * Tools put their JSON payload in the first text block.
 */
public record ToolResult(
        List<ToolContent> content,
        @JsonProperty("isError") @JsonInclude(JsonInclude.Include.NON_DEFAULT) boolean error
) {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public ToolResult {
        content = content == null ? List.of() : List.copyOf(content);
    }

    public static ToolResult success(JsonNode payload) {
        return new ToolResult(List.of(ToolContent.text(payload.toString())), false);
    }

    public static ToolResult failure(JsonNode payload) {
        return new ToolResult(List.of(ToolContent.text(payload.toString())), true);
    }

    public static ToolResult failure(String error) {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("success", false);
        payload.put("error", error);
        return failure(payload);
    }

    /** The first text block parsed as JSON, or a missing node when there is none or it is not JSON. */
    public JsonNode payload() {
        for (ToolContent block : content) {
            if ("text".equals(block.type()) && block.text() != null) {
                try {
                    return MAPPER.readTree(block.text());
                } catch (JsonProcessingException e) {
                    return MissingNode.getInstance();
                }
            }
        }
        return MissingNode.getInstance();
    }
}
