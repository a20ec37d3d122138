package io.github.drompincen.lumenta.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A callable capability exposed through {@code tools/list} and {@code tools/call}. Implementations
 * are discovered with {@link java.util.ServiceLoader} and receive collaborators via public setters.
 */
public interface Tool {

    String name();

    String description();

    /** JSON Schema object with {@code properties} and {@code required}. */
    JsonNode inputSchema();

    /**
     * Runs the tool against arguments that already passed schema validation. Provider rejections
     * are reported as an error result; anything thrown is turned into one by {@link ToolCallService}.
     */
    ToolResult execute(ToolContext ctx, JsonNode arguments);
}
