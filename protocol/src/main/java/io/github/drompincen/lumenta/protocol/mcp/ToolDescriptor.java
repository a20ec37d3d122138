package io.github.drompincen.lumenta.protocol.mcp;

import com.fasterxml.jackson.databind.JsonNode;

public record ToolDescriptor(
        String name,
        String description,
        JsonNode inputSchema
) {}
