package io.github.drompincen.lumenta.protocol.mcp;

public record McpResourceDescriptor(
        String uri,
        String name,
        String description,
        String mimeType
) {
    public static McpResourceDescriptor json(String uri, String name, String description) {
        return new McpResourceDescriptor(uri, name, description, "application/json");
    }
}
