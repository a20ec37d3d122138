package io.github.drompincen.lumenta.protocol.mcp;

public final class ServerInfo {

    public static final String NAME = "lumenta-mcp-server";
    public static final String DISPLAY_NAME = "Lumenta MCP Server";
    public static final String VERSION = "1.0.0";
    public static final String PROTOCOL = "MCP";
    public static final String PROTOCOL_VERSION = "2024-11-05";
    public static final String URI_SCHEME = "lumenta://";

    private ServerInfo() {}
}
