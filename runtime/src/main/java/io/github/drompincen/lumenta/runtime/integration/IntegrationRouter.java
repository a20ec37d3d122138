package io.github.drompincen.lumenta.runtime.integration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.lumenta.protocol.integration.Integration;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/**
 * Rewrites a tool call through a user-configured integration. The integration's config is merged
 * under the call arguments (arguments win), then mapped onto the tool the integration drives.
 * Channel mappings are keyed off the integration id prefix the dashboard assigns.
 */
@Component
public class IntegrationRouter {

    private static final Map<String, Integer> DISCORD_COLORS = Map.of(
            "low", 3447003,
            "medium", 15844367,
            "high", 15158332);
    private static final String DEFAULT_BOT_NAME = "Lumenta Bot";

    private final ObjectMapper objectMapper;

    public IntegrationRouter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RoutedCall route(Integration integration, ObjectNode arguments) {
        if (!integration.active()) {
            throw new IntegrationRoutingException("Integration " + integration.name() + " is not active");
        }
        if (integration.toolName() == null) {
            throw new IntegrationRoutingException("Integration " + integration.name() + " has no associated tool");
        }
        ObjectNode merged = objectMapper.valueToTree(integration.config());
        merged.setAll(arguments.deepCopy());

        return switch (integration.toolName()) {
            case "send_notification" -> routeNotification(integration, arguments, merged);
            case "call_webhook" -> routeWebhook(integration, arguments, merged);
            case "trigger_workflow" -> routeWorkflow(integration, arguments, merged);
            case "call_phone" -> routePhone(integration, arguments, merged);
            default -> throw new IntegrationRoutingException("Unknown tool: " + integration.toolName());
        };
    }

    private RoutedCall routeNotification(Integration integration, ObjectNode args, ObjectNode merged) {
        String id = integration.id();
        ObjectNode notification = objectMapper.createObjectNode();
        notification.put("title", text(merged, "title", "Notification"));
        notification.put("message", text(merged, "message", ""));
        notification.put("severity", text(merged, "severity", "medium"));
        JsonNode channels = merged.path("channels");
        if (channels.isArray()) {
            notification.set("channels", channels.deepCopy());
        } else {
            notification.putArray("channels").add("webhook");
        }
        ObjectNode metadata = notification.putObject("metadata");
        if (merged.path("metadata").isObject()) {
            metadata.setAll((ObjectNode) merged.get("metadata").deepCopy());
        }
        metadata.put("integrationId", id);
        metadata.put("integrationName", integration.name());

        if (id.startsWith("email-service-")) {
            channels(notification, "email");
            putIfPresent(metadata, "recipientEmail", merged.get("email"));
            putIfPresent(metadata, "fromEmail", merged.get("fromEmail"));
        } else if (id.startsWith("slack-")) {
            String webhookUrl = text(merged, "webhookUrl", null);
            if (webhookUrl != null) {
                ObjectNode body = objectMapper.createObjectNode();
                body.put("text", notification.get("message").asText());
                putIfPresent(body, "channel", merged.get("channel"));
                return new RoutedCall(id, "call_webhook", webhookCall(webhookUrl, body));
            }
            channels(notification, "webhook");
        } else if (id.startsWith("discord-")) {
            String mode = text(merged, "mode", "webhook");
            String webhookUrl = text(merged, "webhookUrl", null);
            if ("webhook".equals(mode) && webhookUrl != null) {
                return new RoutedCall(id, "call_webhook", webhookCall(webhookUrl, discordBody(notification, merged)));
            }
            if ("bot".equals(mode)) {
                metadata.put("discordMode", "bot");
                putIfPresent(metadata, "botToken", merged.get("botToken"));
                ArrayNode recipients = metadata.putArray("recipientUserIds");
                String userIds = text(args.path("metadata"), "recipientUserIds", text(merged, "recipientUserIds", null));
                if (userIds != null) {
                    for (String userId : userIds.split(",")) {
                        if (!userId.isBlank()) {
                            recipients.add(userId.trim());
                        }
                    }
                }
                String channelId = text(args.path("metadata"), "channelId",
                        text(merged, "defaultChannelId", text(merged, "channelId", null)));
                if (channelId != null) {
                    metadata.put("channelId", channelId);
                }
                metadata.put("username", text(merged, "username", DEFAULT_BOT_NAME));
            }
        } else if (id.startsWith("sms-")) {
            channels(notification, "sms");
            putIfPresent(metadata, "recipientPhone", merged.get("phoneNumber"));
        } else if (id.startsWith("push-notification-")) {
            channels(notification, "push");
            putIfPresent(metadata, "deviceToken", merged.get("deviceToken"));
        }
        return new RoutedCall(id, "send_notification", notification);
    }

    private ObjectNode discordBody(ObjectNode notification, ObjectNode merged) {
        String severity = notification.get("severity").asText();
        ObjectNode body = objectMapper.createObjectNode();
        body.put("content", notification.get("message").asText());
        body.put("username", text(merged, "username", DEFAULT_BOT_NAME));
        ObjectNode embed = body.putArray("embeds").addObject();
        embed.put("title", notification.get("title").asText());
        embed.put("description", notification.get("message").asText());
        embed.put("color", DISCORD_COLORS.getOrDefault(severity, DISCORD_COLORS.get("low")));
        embed.put("timestamp", Instant.now().toString());
        return body;
    }

    private RoutedCall routeWebhook(Integration integration, ObjectNode args, ObjectNode merged) {
        String url = text(merged, "url", null);
        if (url == null) {
            throw new IntegrationRoutingException("Webhook URL is required");
        }
        ObjectNode call = objectMapper.createObjectNode();
        call.put("url", url);
        call.put("method", text(merged, "method", "POST"));
        JsonNode headers = integration.config().containsKey("headers") ? merged.get("headers") : args.get("headers");
        if (headers != null && headers.isTextual()) {
            try {
                headers = objectMapper.readTree(headers.asText());
            } catch (JsonProcessingException e) {
                throw new IntegrationRoutingException("Integration headers are not valid JSON", e);
            }
        }
        if (headers != null && headers.isObject()) {
            call.set("headers", headers);
        }
        JsonNode body = args.hasNonNull("body") ? args.get("body") : merged.get("body");
        if (body != null && !body.isNull()) {
            call.set("body", body.deepCopy());
        }
        return new RoutedCall(integration.id(), "call_webhook", call);
    }

    private RoutedCall routeWorkflow(Integration integration, ObjectNode args, ObjectNode merged) {
        String workflowId = text(merged, "workflowId", null);
        if (workflowId == null) {
            throw new IntegrationRoutingException("Workflow ID is required");
        }
        ObjectNode call = objectMapper.createObjectNode();
        call.put("workflowId", workflowId);
        ObjectNode input = call.putObject("input");
        JsonNode configInput = objectMapper.valueToTree(integration.config()).path("input");
        if (configInput.isObject()) {
            input.setAll((ObjectNode) configInput);
        }
        if (args.path("input").isObject()) {
            input.setAll((ObjectNode) args.get("input").deepCopy());
        }
        input.put("triggeredBy", integration.id());
        return new RoutedCall(integration.id(), "trigger_workflow", call);
    }

    private RoutedCall routePhone(Integration integration, ObjectNode args, ObjectNode merged) {
        String to = text(args, "to", text(merged, "phoneNumber", null));
        if (to == null) {
            throw new IntegrationRoutingException(
                    "Phone number is required. Provide when calling the tool or configure in integration settings.");
        }
        ObjectNode call = objectMapper.createObjectNode();
        call.put("to", to);
        String message = text(args, "message", text(merged, "message", null));
        if (message != null) {
            call.put("message", message);
        }
        call.put("provider", "vapi");
        String assistantId = text(merged, "assistantId", null);
        if (integration.config().get("assistantId") instanceof String configured && !configured.isBlank()) {
            assistantId = configured;
        }
        if (assistantId != null) {
            call.put("assistantId", assistantId);
        }
        return new RoutedCall(integration.id(), "call_phone", call);
    }

    private ObjectNode webhookCall(String url, ObjectNode body) {
        ObjectNode call = objectMapper.createObjectNode();
        call.put("url", url);
        call.put("method", "POST");
        call.set("body", body);
        return call;
    }

    private static void channels(ObjectNode notification, String channel) {
        notification.putArray("channels").add(channel);
    }

    private static void putIfPresent(ObjectNode target, String field, JsonNode value) {
        if (value != null && !value.isNull() && !value.isMissingNode()) {
            target.set(field, value.deepCopy());
        }
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return fallback;
        }
        String text = value.asText();
        return text.isEmpty() ? fallback : text;
    }
}
