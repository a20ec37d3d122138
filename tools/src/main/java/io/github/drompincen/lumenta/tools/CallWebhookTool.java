package io.github.drompincen.lumenta.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.lumenta.runtime.provider.ProviderException;
import io.github.drompincen.lumenta.runtime.provider.WebhookClient;
import io.github.drompincen.lumenta.runtime.provider.WebhookResponse;
import io.github.drompincen.lumenta.runtime.tools.Tool;
import io.github.drompincen.lumenta.runtime.tools.ToolContext;
import io.github.drompincen.lumenta.runtime.tools.ToolResult;

import java.util.LinkedHashMap;
import java.util.Map;

public class CallWebhookTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private WebhookClient webhookClient;

    @Override public String name() { return "call_webhook"; }
    @Override public String description() { return "Make an HTTP request to an external webhook URL"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("url").put("type", "string").put("description", "The webhook URL to call");
        ObjectNode method = props.putObject("method");
        method.put("type", "string").put("description", "HTTP method to use").put("default", "POST");
        method.putArray("enum").add("GET").add("POST").add("PUT").add("DELETE");
        props.putObject("headers").put("type", "object").put("description", "HTTP headers to include in the request");
        props.putObject("body").put("type", "object").put("description", "Request body (for POST/PUT requests)");
        schema.putArray("required").add("url");
        return schema;
    }

    public void setWebhookClient(WebhookClient webhookClient) {
        this.webhookClient = webhookClient;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode arguments) {
        if (webhookClient == null) {
            return ToolResult.failure("Webhook client not available");
        }
        String url = arguments.path("url").asText();
        String method = arguments.path("method").asText("POST");
        Map<String, String> headers = new LinkedHashMap<>();
        arguments.path("headers").fields().forEachRemaining(e -> headers.put(e.getKey(), e.getValue().asText()));
        JsonNode body = arguments.get("body");

        WebhookResponse response;
        try {
            response = webhookClient.exchange(url, method, headers, body == null || body.isNull() ? null : body);
        } catch (ProviderException e) {
            return ToolResult.failure(e.getMessage());
        }

        ObjectNode result = MAPPER.createObjectNode();
        result.put("success", response.ok());
        result.put("status", response.status());
        result.put("statusText", response.statusText());
        result.put("response", response.body());
        return response.ok() ? ToolResult.success(result) : ToolResult.failure(result);
    }
}
