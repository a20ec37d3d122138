package io.github.drompincen.lumenta.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.lumenta.runtime.provider.CallReceipt;
import io.github.drompincen.lumenta.runtime.provider.PhoneCaller;
import io.github.drompincen.lumenta.runtime.provider.ProviderException;
import io.github.drompincen.lumenta.runtime.tools.Tool;
import io.github.drompincen.lumenta.runtime.tools.ToolContext;
import io.github.drompincen.lumenta.runtime.tools.ToolResult;

/**
 * Outbound assistant call through Vapi. What the assistant says is configured on the Vapi side;
 * {@code message} is accepted for callers that have one but is not sent.
 */
public class CallPhoneTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String PROVIDER = "vapi";

    private PhoneCaller phoneCaller;

    @Override public String name() { return "call_phone"; }
    @Override public String description() {
        return "Make a phone call using Vapi. The message/prompt is configured in your Vapi assistant, not passed here.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("to").put("type", "string")
                .put("description", "Phone number to call (with country code, e.g., +1234567890)");
        props.putObject("message").put("type", "string")
                .put("description", "Optional note about the call; the spoken script comes from the assistant");
        props.putObject("assistantId").put("type", "string")
                .put("description", "Vapi assistant ID (UUID). Falls back to the configured assistant.");
        props.putObject("provider").put("type", "string").putArray("enum").add(PROVIDER);
        schema.putArray("required").add("to");
        return schema;
    }

    public void setPhoneCaller(PhoneCaller phoneCaller) {
        this.phoneCaller = phoneCaller;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode arguments) {
        if (phoneCaller == null) {
            return ToolResult.failure("Phone caller not available");
        }
        String to = arguments.path("to").asText();
        JsonNode assistant = arguments.get("assistantId");
        String assistantId = assistant == null || assistant.isNull() || assistant.asText().isBlank()
                ? null : assistant.asText();

        try {
            CallReceipt receipt = phoneCaller.call(to, assistantId);
            ObjectNode result = MAPPER.createObjectNode();
            result.put("success", true);
            result.put("message", "Phone call initiated via Vapi");
            result.put("callId", receipt.callId());
            result.put("status", receipt.status());
            result.put("provider", PROVIDER);
            result.put("to", to);
            return ToolResult.success(result);
        } catch (ProviderException e) {
            ObjectNode failure = MAPPER.createObjectNode();
            failure.put("success", false);
            failure.put("error", e.getMessage());
            failure.put("provider", PROVIDER);
            return ToolResult.failure(failure);
        }
    }
}
