package io.github.drompincen.lumenta.runtime.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.lumenta.protocol.jsonrpc.JsonRpcError;
import io.github.drompincen.lumenta.protocol.jsonrpc.JsonRpcRequest;
import io.github.drompincen.lumenta.protocol.jsonrpc.JsonRpcResponse;
import io.github.drompincen.lumenta.protocol.mcp.McpResourceContent;
import io.github.drompincen.lumenta.protocol.mcp.ServerInfo;
import io.github.drompincen.lumenta.runtime.tools.InvalidToolArgumentsException;
import io.github.drompincen.lumenta.runtime.tools.ToolCallOrigin;
import io.github.drompincen.lumenta.runtime.tools.ToolCallService;
import io.github.drompincen.lumenta.runtime.tools.ToolRegistry;
import io.github.drompincen.lumenta.runtime.tools.UnknownToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON-RPC 2.0 front door of the MCP server. Every outcome, including malformed input, is
 * returned as a {@link JsonRpcResponse}; nothing is thrown to the caller.
 */
@Service
public class McpDispatcher {

    private static final Logger log = LoggerFactory.getLogger(McpDispatcher.class);

    private final ObjectMapper objectMapper;
    private final ResourceCatalog resourceCatalog;
    private final ToolRegistry toolRegistry;
    private final ToolCallService toolCallService;

    public McpDispatcher(ObjectMapper objectMapper, ResourceCatalog resourceCatalog,
                         ToolRegistry toolRegistry, ToolCallService toolCallService) {
        this.objectMapper = objectMapper;
        this.resourceCatalog = resourceCatalog;
        this.toolRegistry = toolRegistry;
        this.toolCallService = toolCallService;
    }

    public JsonRpcResponse handle(String body) {
        JsonNode root;
        try {
            root = body == null ? null : objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return JsonRpcResponse.failure(NullNode.instance,
                    new JsonRpcError(JsonRpcError.PARSE_ERROR, "Parse error", TextNode.valueOf(e.getOriginalMessage())));
        }
        if (root == null || root.isMissingNode()) {
            return JsonRpcResponse.failure(NullNode.instance, JsonRpcError.of(JsonRpcError.PARSE_ERROR, "Parse error"));
        }
        if (!root.isObject()) {
            return JsonRpcResponse.failure(NullNode.instance, JsonRpcError.of(JsonRpcError.INVALID_REQUEST, "Invalid Request"));
        }

        JsonNode id = root.path("id");
        if (!isValidId(id)) {
            return JsonRpcResponse.failure(NullNode.instance, JsonRpcError.of(JsonRpcError.INVALID_REQUEST, "Invalid Request"));
        }
        JsonNode method = root.path("method");
        if (!JsonRpcRequest.VERSION.equals(root.path("jsonrpc").asText(null))
                || !method.isTextual() || method.asText().isBlank()) {
            return JsonRpcResponse.failure(id, JsonRpcError.of(JsonRpcError.INVALID_REQUEST, "Invalid Request"));
        }
        return dispatch(new JsonRpcRequest(JsonRpcRequest.VERSION, id, method.asText(), root.get("params")));
    }

    public JsonRpcResponse dispatch(JsonRpcRequest request) {
        try {
            Object result = switch (request.method()) {
                case "initialize" -> initialize();
                case "ping" -> Map.of();
                case "resources/list" -> Map.of("resources", resourceCatalog.list());
                case "resources/read" -> readResource(request.params());
                case "tools/list" -> Map.of("tools", toolRegistry.descriptors());
                case "tools/call" -> callTool(request.params());
                default -> throw new JsonRpcException(JsonRpcError.METHOD_NOT_FOUND,
                        "Method not found: " + request.method());
            };
            return JsonRpcResponse.success(request.id(), result);
        } catch (JsonRpcException e) {
            log.debug("JSON-RPC {} rejected: {}", request.method(), e.getMessage());
            return JsonRpcResponse.failure(request.id(), e.toError());
        } catch (UnknownToolException e) {
            return JsonRpcResponse.failure(request.id(), JsonRpcError.of(JsonRpcError.INVALID_PARAMS, e.getMessage()));
        } catch (InvalidToolArgumentsException e) {
            return JsonRpcResponse.failure(request.id(),
                    new JsonRpcError(JsonRpcError.INVALID_PARAMS, e.getMessage(), e.data()));
        } catch (RuntimeException e) {
            log.error("JSON-RPC {} failed", request.method(), e);
            String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return JsonRpcResponse.failure(request.id(),
                    new JsonRpcError(JsonRpcError.INTERNAL_ERROR, "Internal error", TextNode.valueOf(detail)));
        }
    }

    private Map<String, Object> initialize() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("protocolVersion", ServerInfo.PROTOCOL_VERSION);
        result.put("capabilities", Map.of("resources", Map.of(), "tools", Map.of()));
        result.put("serverInfo", Map.of("name", ServerInfo.NAME, "version", ServerInfo.VERSION));
        return result;
    }

    private Map<String, Object> readResource(JsonNode params) {
        String uri = textParam(params, "uri");
        McpResourceContent content = resourceCatalog.read(uri)
                .orElseThrow(() -> new JsonRpcException(JsonRpcError.INVALID_PARAMS, "Resource not found: " + uri));
        return Map.of("contents", List.of(content));
    }

    private Object callTool(JsonNode params) {
        String name = textParam(params, "name");
        JsonNode arguments = params.get("arguments");
        return toolCallService.call(name, arguments, ToolCallOrigin.JSON_RPC);
    }

    private static String textParam(JsonNode params, String field) {
        JsonNode value = params == null ? null : params.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new JsonRpcException(JsonRpcError.INVALID_PARAMS, "Missing required parameter: " + field);
        }
        return value.asText();
    }

    /** JSON-RPC ids are strings, numbers or null; an absent id marks a notification. */
    private static boolean isValidId(JsonNode id) {
        return id.isMissingNode() || id.isNull() || id.isTextual() || id.isNumber();
    }

    /** Errors in the envelope itself, answered with HTTP 400 by the transport. */
    public static boolean isEnvelopeError(JsonRpcResponse response) {
        return response.hasError() && (response.error().code() == JsonRpcError.PARSE_ERROR
                || response.error().code() == JsonRpcError.INVALID_REQUEST);
    }

    /** Plain summary served on {@code GET /api/mcp}. */
    public ObjectNode serverCapabilities() {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("name", ServerInfo.DISPLAY_NAME);
        node.put("version", ServerInfo.VERSION);
        node.put("protocol", ServerInfo.PROTOCOL);
        ObjectNode caps = node.putObject("capabilities");
        caps.put("resources", true);
        caps.put("tools", true);
        return node;
    }
}
