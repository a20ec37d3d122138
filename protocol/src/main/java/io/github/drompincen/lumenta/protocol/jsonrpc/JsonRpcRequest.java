package io.github.drompincen.lumenta.protocol.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * Inbound JSON-RPC 2.0 message. {@code id} keeps its original JSON type (string, number or null).
 */
public record JsonRpcRequest(
        String jsonrpc,
        JsonNode id,
        String method,
        JsonNode params
) {
    public static final String VERSION = "2.0";

    public static JsonRpcRequest of(Object id, String method, JsonNode params) {
        JsonNode idNode = id == null ? NullNode.instance
                : id instanceof Number n ? LongNode.valueOf(n.longValue())
                : TextNode.valueOf(id.toString());
        return new JsonRpcRequest(VERSION, idNode, method, params);
    }
}
