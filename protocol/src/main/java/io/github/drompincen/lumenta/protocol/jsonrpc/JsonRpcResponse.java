package io.github.drompincen.lumenta.protocol.jsonrpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Outbound JSON-RPC 2.0 message. Exactly one of {@code result} and {@code error} is set;
 * {@code id} is always written, as {@code null} when the request id could not be read.
 */
public record JsonRpcResponse(
        String jsonrpc,
        JsonNode id,
        @JsonInclude(JsonInclude.Include.NON_NULL) Object result,
        @JsonInclude(JsonInclude.Include.NON_NULL) JsonRpcError error
) {
    public static JsonRpcResponse success(JsonNode id, Object result) {
        return new JsonRpcResponse(JsonRpcRequest.VERSION, normalize(id), result, null);
    }

    public static JsonRpcResponse failure(JsonNode id, JsonRpcError error) {
        return new JsonRpcResponse(JsonRpcRequest.VERSION, normalize(id), null, error);
    }

    public boolean hasError() {
        return error != null;
    }

    private static JsonNode normalize(JsonNode id) {
        return id == null || id.isMissingNode() ? NullNode.instance : id;
    }
}
