package io.github.drompincen.lumenta.runtime.action;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.lumenta.protocol.api.ActionExecutionResult;
import io.github.drompincen.lumenta.runtime.llm.LlmRequest;
import io.github.drompincen.lumenta.runtime.llm.LlmService;
import io.github.drompincen.lumenta.runtime.llm.ModelJson;
import io.github.drompincen.lumenta.runtime.tools.ToolCallOrigin;
import io.github.drompincen.lumenta.runtime.tools.ToolCallService;
import io.github.drompincen.lumenta.runtime.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns a workflow action node ("call", "email" or "text" plus a free-text description) into a
 * tool call. The model only extracts parameters; nothing is dispatched unless a recipient was found.
 */
@Service
public class ActionNodeExecutor {

    private static final Logger log = LoggerFactory.getLogger(ActionNodeExecutor.class);

    static final double PARSE_TEMPERATURE = 0.2;
    static final int PARSE_MAX_TOKENS = 1024;
    static final String DEFAULT_MESSAGE = "Notification from Lumenta";

    private final LlmService llmService;
    private final ToolCallService toolCallService;
    private final ObjectMapper objectMapper;

    public ActionNodeExecutor(LlmService llmService, ToolCallService toolCallService, ObjectMapper objectMapper) {
        this.llmService = llmService;
        this.toolCallService = toolCallService;
        this.objectMapper = objectMapper;
    }

    public ActionExecutionResult execute(ActionOption option, String description, String apiKey) {
        try {
            JsonNode params = extractParameters(option, description == null ? "" : description, apiKey);
            log.debug("Action {} parameters: {}", option.wire(), params);
            return switch (option) {
                case CALL -> executeCall(params);
                case EMAIL -> executeEmail(params);
                case TEXT -> executeText(params);
            };
        } catch (RuntimeException e) {
            log.warn("Action {} failed: {}", option.wire(), e.getMessage());
            return ActionExecutionResult.failed("Failed to execute action",
                    e.getMessage() != null ? e.getMessage() : "Unknown error");
        }
    }

    private JsonNode extractParameters(ActionOption option, String description, String apiKey) {
        String text = llmService.blockingResponse(new LlmRequest(apiKey, ActionPrompts.parsing(option, description),
                PARSE_TEMPERATURE, PARSE_MAX_TOKENS, true));
        JsonNode parameters = ModelJson.parseObject(objectMapper, text).path("parameters");
        return parameters.isObject() ? parameters : objectMapper.createObjectNode();
    }

    private ActionExecutionResult executeCall(JsonNode params) {
        String phone = firstText(params, "to", "phoneNumber", "phone");
        if (phone == null) {
            return ActionExecutionResult.failed("Phone number is required for call action",
                    "Missing 'to' parameter. Please include a phone number in the description (e.g., 'Call +1234567890').");
        }
        String normalized = PhoneNumbers.normalize(phone);
        ObjectNode args = objectMapper.createObjectNode();
        args.put("to", normalized);
        putIfPresent(args, "message", firstText(params, "message"));
        putIfPresent(args, "assistantId", firstText(params, "assistantId"));

        return dispatch("call_phone", args, null,
                "Phone call initiated to " + normalized, "Failed to initiate phone call");
    }

    private ActionExecutionResult executeEmail(JsonNode params) {
        String recipient = firstText(params, "recipientEmail", "email", "to");
        if (recipient == null) {
            return ActionExecutionResult.failed("Email address is required for email action",
                    "Missing recipient email. Please include an email address in the description (e.g., 'Email john@example.com').");
        }
        ObjectNode args = objectMapper.createObjectNode();
        args.put("title", orDefault(firstText(params, "title", "subject"), DEFAULT_MESSAGE));
        args.put("message", orDefault(firstText(params, "message", "body"), DEFAULT_MESSAGE));
        args.putArray("channels").add("email");
        ObjectNode metadata = args.putObject("metadata");
        metadata.put("recipientEmail", recipient);
        putIfPresent(metadata, "fromEmail", firstText(params, "fromEmail"));

        return dispatch("send_notification", args, "email",
                "Email sent to " + recipient, "Failed to send email");
    }

    private ActionExecutionResult executeText(JsonNode params) {
        String phone = firstText(params, "recipientPhone", "phone", "to");
        if (phone == null) {
            return ActionExecutionResult.failed("Phone number is required for text action",
                    "Missing recipient phone number. Please include a phone number in the description (e.g., 'Text +1234567890').");
        }
        String normalized = PhoneNumbers.normalize(phone);
        ObjectNode args = objectMapper.createObjectNode();
        args.put("title", orDefault(firstText(params, "title"), "Lumenta Alert"));
        args.put("message", orDefault(firstText(params, "message", "text"), DEFAULT_MESSAGE));
        args.putArray("channels").add("sms");
        args.putObject("metadata").put("recipientPhone", normalized);

        return dispatch("send_notification", args, "sms",
                "Text message sent to " + normalized, "Failed to send text message");
    }

    private ActionExecutionResult dispatch(String tool, ObjectNode args, String channel,
                                           String successMessage, String failureMessage) {
        ToolResult result = toolCallService.call(tool, args, ToolCallOrigin.ACTION_NODE);
        JsonNode payload = result.payload();
        Object body = payload.isMissingNode() ? null : payload;
        if (!result.error() && payload.path("success").asBoolean(false)) {
            log.info("Action dispatched via {}: {}", tool, successMessage);
            return ActionExecutionResult.succeeded(successMessage, body);
        }
        String error = channel != null ? payload.path("results").path(channel).path("error").asText(null) : null;
        if (error == null) {
            error = payload.path("error").asText("Unknown error");
        }
        return new ActionExecutionResult(false, failureMessage, body, error);
    }

    private static String firstText(JsonNode params, String... fields) {
        for (String field : fields) {
            JsonNode value = params.get(field);
            if (value != null && value.isValueNode() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return null;
    }

    private static String orDefault(String value, String fallback) {
        return value != null ? value : fallback;
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
