package io.github.drompincen.lumenta.protocol.mcp;

public record McpResourceContent(
        String uri,
        String mimeType,
        String text
) {}
