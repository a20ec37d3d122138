package io.github.drompincen.lumenta.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.lumenta.runtime.provider.EmailMessage;
import io.github.drompincen.lumenta.runtime.provider.EmailReceipt;
import io.github.drompincen.lumenta.runtime.provider.EmailSender;
import io.github.drompincen.lumenta.runtime.provider.ProviderException;
import io.github.drompincen.lumenta.runtime.provider.SmsReceipt;
import io.github.drompincen.lumenta.runtime.provider.SmsSender;
import io.github.drompincen.lumenta.runtime.tools.Tool;
import io.github.drompincen.lumenta.runtime.tools.ToolContext;
import io.github.drompincen.lumenta.runtime.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fans one notification out to the requested channels. Each channel reports its own result;
 * the call is an error when any channel failed.
 */
public class SendNotificationTool implements Tool {

    private static final Logger log = LoggerFactory.getLogger(SendNotificationTool.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String DEFAULT_SEVERITY = "medium";
    static final String DEFAULT_CHANNEL = "webhook";

    private EmailSender emailSender;
    private SmsSender smsSender;

    @Override public String name() { return "send_notification"; }
    @Override public String description() { return "Send a notification through one or more channels (email, SMS, push, webhook)"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("title").put("type", "string").put("description", "Notification title");
        props.putObject("message").put("type", "string").put("description", "Notification message body");
        ObjectNode severity = props.putObject("severity");
        severity.put("type", "string").put("description", "Notification severity level");
        severity.putArray("enum").add("low").add("medium").add("high");
        ObjectNode channels = props.putObject("channels");
        channels.put("type", "array").put("description", "Channels to send the notification through");
        ObjectNode items = channels.putObject("items");
        items.put("type", "string");
        items.putArray("enum").add("email").add("sms").add("push").add("webhook");
        props.putObject("metadata").put("type", "object")
                .put("description", "Delivery details: recipientEmail, fromEmail, recipientPhone");
        schema.putArray("required").add("title").add("message");
        return schema;
    }

    public void setEmailSender(EmailSender emailSender) {
        this.emailSender = emailSender;
    }

    public void setSmsSender(SmsSender smsSender) {
        this.smsSender = smsSender;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode arguments) {
        String title = arguments.path("title").asText();
        String message = arguments.path("message").asText();
        String severity = arguments.path("severity").asText(DEFAULT_SEVERITY);
        JsonNode metadata = arguments.path("metadata");
        List<String> channels = channels(arguments.path("channels"));

        ObjectNode results = MAPPER.createObjectNode();
        String emailRecipient = null;
        for (String channel : channels) {
            switch (channel) {
                case "email" -> {
                    ObjectNode email = sendEmail(title, message, arguments.hasNonNull("severity") ? severity : null, metadata);
                    if (email.path("success").asBoolean()) {
                        emailRecipient = email.path("recipient").asText();
                    }
                    results.set("email", email);
                }
                case "sms" -> results.set("sms", sendSms(title, message, metadata));
                case "push" -> results.set("push", failed("Push notification sending not yet implemented."));
                case "webhook" -> {
                    ObjectNode webhook = MAPPER.createObjectNode();
                    webhook.put("success", true);
                    webhook.put("message", "Webhook notifications should use the call_webhook tool directly");
                    results.set("webhook", webhook);
                }
                default -> results.set(channel, failed("Unsupported channel: " + channel));
            }
        }

        boolean allSucceeded = true;
        for (JsonNode channelResult : results) {
            allSucceeded &= channelResult.path("success").asBoolean(true);
        }

        ObjectNode result = MAPPER.createObjectNode();
        result.put("success", allSucceeded);
        result.put("message", emailRecipient != null
                ? "Email sent successfully to " + emailRecipient
                : allSucceeded ? "Notification sent successfully" : "One or more channels failed");
        ArrayNode channelList = result.putArray("channels");
        channels.forEach(channelList::add);
        result.set("results", results);
        ObjectNode notification = result.putObject("notification");
        notification.put("title", title);
        notification.put("message", message);
        notification.put("severity", severity);
        return allSucceeded ? ToolResult.success(result) : ToolResult.failure(result);
    }

    private ObjectNode sendEmail(String title, String message, String severity, JsonNode metadata) {
        String recipient = metadata.path("recipientEmail").asText(null);
        if (recipient == null || recipient.isBlank()) {
            return failed("Recipient email is required for email notifications. Configure it in your Email Service integration.");
        }
        if (emailSender == null) {
            return failed("Email sender not available");
        }
        String from = metadata.path("fromEmail").asText(null);
        EmailMessage email = new EmailMessage(from == null || from.isBlank() ? null : from, recipient,
                title.isBlank() ? "Notification from Lumenta" : title,
                NotificationBodies.html(title, message, severity),
                NotificationBodies.text(title, message, severity));
        try {
            EmailReceipt receipt = emailSender.send(email);
            ObjectNode ok = MAPPER.createObjectNode();
            ok.put("success", true);
            ok.put("messageId", receipt.messageId());
            ok.put("recipient", recipient);
            ok.put("from", receipt.from());
            if (receipt.defaultSenderUsed()) {
                ok.put("note", "Used Resend's default domain (onboarding@resend.dev) because the custom domain is not verified. "
                        + "Verify your domain at https://resend.com/domains to use a custom 'from' address.");
            }
            return ok;
        } catch (ProviderException e) {
            log.warn("Email to {} failed: {}", recipient, e.getMessage());
            return failed(e.getMessage());
        }
    }

    private ObjectNode sendSms(String title, String message, JsonNode metadata) {
        String recipient = metadata.path("recipientPhone").asText(null);
        if (recipient == null || recipient.isBlank()) {
            return failed("Recipient phone number is required for SMS notifications. Configure it in your SMS Service integration.");
        }
        if (smsSender == null) {
            return failed("SMS sender not available");
        }
        try {
            SmsReceipt receipt = smsSender.send(recipient, (title.isBlank() ? "Notification" : title) + "\n\n" + message);
            ObjectNode ok = MAPPER.createObjectNode();
            ok.put("success", true);
            ok.put("messageId", receipt.messageId());
            ok.put("recipient", recipient);
            ok.put("from", receipt.from());
            ok.put("status", receipt.status());
            ok.put("remainingBalance", receipt.remainingBalance());
            return ok;
        } catch (ProviderException e) {
            log.warn("SMS to {} failed: {}", recipient, e.getMessage());
            return failed(e.getMessage());
        }
    }

    private static List<String> channels(JsonNode requested) {
        Set<String> channels = new LinkedHashSet<>();
        if (requested.isArray()) {
            requested.forEach(c -> channels.add(c.asText()));
        }
        if (channels.isEmpty()) {
            channels.add(DEFAULT_CHANNEL);
        }
        return new ArrayList<>(channels);
    }

    private static ObjectNode failed(String error) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("success", false);
        node.put("error", error);
        return node;
    }
}
