package io.github.drompincen.lumenta.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.lumenta.runtime.provider.EmailMessage;
import io.github.drompincen.lumenta.runtime.provider.EmailReceipt;
import io.github.drompincen.lumenta.runtime.provider.EmailSender;
import io.github.drompincen.lumenta.runtime.provider.ProviderException;
import io.github.drompincen.lumenta.runtime.provider.SmsReceipt;
import io.github.drompincen.lumenta.runtime.provider.SmsSender;
import io.github.drompincen.lumenta.runtime.tools.ToolCallOrigin;
import io.github.drompincen.lumenta.runtime.tools.ToolContext;
import io.github.drompincen.lumenta.runtime.tools.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SendNotificationToolTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock private EmailSender emailSender;
    @Mock private SmsSender smsSender;

    private SendNotificationTool tool;
    private ToolContext ctx;

    @BeforeEach
    void setUp() {
        tool = new SendNotificationTool();
        tool.setEmailSender(emailSender);
        tool.setSmsSender(smsSender);
        ctx = ToolContext.of("call-1", ToolCallOrigin.ACTION_NODE);
    }

    @Test
    void toolMetadata() {
        assertThat(tool.name()).isEqualTo("send_notification");
        assertThat(tool.inputSchema().path("required")).hasSize(2);
    }

    @Test
    void defaultsToWebhookChannel() {
        ToolResult result = tool.execute(ctx, notification());

        JsonNode payload = result.payload();
        assertThat(result.error()).isFalse();
        assertThat(payload.path("channels").get(0).asText()).isEqualTo("webhook");
        assertThat(payload.path("message").asText()).isEqualTo("Notification sent successfully");
        assertThat(payload.path("notification").path("severity").asText()).isEqualTo("medium");
        verifyNoInteractions(emailSender, smsSender);
    }

    @Test
    void emailChannelSendsHtmlAndReportsRecipient() {
        when(emailSender.send(any())).thenReturn(new EmailReceipt("em_1", "alerts@lumenta.test", false));
        ObjectNode args = notification().put("severity", "high");
        args.putArray("channels").add("email");
        args.putObject("metadata").put("recipientEmail", "ops@example.com").put("fromEmail", "alerts@lumenta.test");

        ToolResult result = tool.execute(ctx, args);

        ArgumentCaptor<EmailMessage> captor = ArgumentCaptor.forClass(EmailMessage.class);
        verify(emailSender).send(captor.capture());
        EmailMessage sent = captor.getValue();
        assertThat(sent.to()).isEqualTo("ops@example.com");
        assertThat(sent.from()).isEqualTo("alerts@lumenta.test");
        assertThat(sent.subject()).isEqualTo("Intruder <alert>");
        assertThat(sent.html()).contains("Intruder &lt;alert&gt;").contains("Severity:</strong> high");
        assertThat(sent.text()).contains("Person at back door");

        assertThat(result.error()).isFalse();
        assertThat(result.payload().path("message").asText()).isEqualTo("Email sent successfully to ops@example.com");
        assertThat(result.payload().path("results").path("email").path("messageId").asText()).isEqualTo("em_1");
    }

    @Test
    void defaultSenderFallbackIsNoted() {
        when(emailSender.send(any())).thenReturn(new EmailReceipt("em_2", "onboarding@resend.dev", true));
        ObjectNode args = notification();
        args.putArray("channels").add("email");
        args.putObject("metadata").put("recipientEmail", "ops@example.com");

        ToolResult result = tool.execute(ctx, args);

        assertThat(result.payload().path("results").path("email").path("note").asText()).contains("onboarding@resend.dev");
    }

    @Test
    void missingRecipientFailsThatChannelOnly() {
        when(smsSender.send(eq("+15551234567"), any()))
                .thenReturn(new SmsReceipt("m-1", "+15551234567", "Lumenta", "0", "9.50"));
        ObjectNode args = notification();
        args.putArray("channels").add("email").add("sms");
        args.putObject("metadata").put("recipientPhone", "+15551234567");

        ToolResult result = tool.execute(ctx, args);

        assertThat(result.error()).isTrue();
        JsonNode results = result.payload().path("results");
        assertThat(results.path("email").path("success").asBoolean()).isFalse();
        assertThat(results.path("email").path("error").asText()).startsWith("Recipient email is required");
        assertThat(results.path("sms").path("success").asBoolean()).isTrue();
        assertThat(result.payload().path("message").asText()).isEqualTo("One or more channels failed");
    }

    @Test
    void smsTextJoinsTitleAndMessage() {
        when(smsSender.send(any(), any())).thenReturn(new SmsReceipt("m-1", "+15551234567", "Lumenta", "0", null));
        ObjectNode args = notification();
        args.putArray("channels").add("sms");
        args.putObject("metadata").put("recipientPhone", "+15551234567");

        tool.execute(ctx, args);

        verify(smsSender).send("+15551234567", "Intruder <alert>\n\nPerson at back door");
    }

    @Test
    void providerFailureIsReportedPerChannel() {
        when(emailSender.send(any())).thenThrow(new ProviderException("resend", "Resend API error: invalid key"));
        ObjectNode args = notification();
        args.putArray("channels").add("email");
        args.putObject("metadata").put("recipientEmail", "ops@example.com");

        ToolResult result = tool.execute(ctx, args);

        assertThat(result.error()).isTrue();
        assertThat(result.payload().path("success").asBoolean()).isFalse();
        assertThat(result.payload().path("results").path("email").path("error").asText())
                .isEqualTo("Resend API error: invalid key");
    }

    @Test
    void pushIsNotImplemented() {
        ObjectNode args = notification();
        args.putArray("channels").add("push");

        ToolResult result = tool.execute(ctx, args);

        assertThat(result.error()).isTrue();
        assertThat(result.payload().path("results").path("push").path("error").asText())
                .isEqualTo("Push notification sending not yet implemented.");
    }

    private static ObjectNode notification() {
        return MAPPER.createObjectNode().put("title", "Intruder <alert>").put("message", "Person at back door");
    }
}
