package io.github.drompincen.lumenta.runtime.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.lumenta.protocol.jsonrpc.JsonRpcError;

/**
 * Raised inside a method handler to answer with a specific JSON-RPC error.
 */
public class JsonRpcException extends RuntimeException {

    private final int code;
    private final JsonNode data;

    public JsonRpcException(int code, String message) {
        this(code, message, null);
    }

    public JsonRpcException(int code, String message, JsonNode data) {
        super(message);
        this.code = code;
        this.data = data;
    }

    public int code() {
        return code;
    }

    public JsonRpcError toError() {
        return new JsonRpcError(code, getMessage(), data);
    }
}
