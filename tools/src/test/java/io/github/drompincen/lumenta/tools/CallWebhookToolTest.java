package io.github.drompincen.lumenta.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.lumenta.runtime.provider.ProviderException;
import io.github.drompincen.lumenta.runtime.provider.WebhookClient;
import io.github.drompincen.lumenta.runtime.provider.WebhookResponse;
import io.github.drompincen.lumenta.runtime.tools.ToolCallOrigin;
import io.github.drompincen.lumenta.runtime.tools.ToolContext;
import io.github.drompincen.lumenta.runtime.tools.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CallWebhookToolTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock private WebhookClient webhookClient;

    private CallWebhookTool tool;
    private ToolContext ctx;

    @BeforeEach
    void setUp() {
        tool = new CallWebhookTool();
        tool.setWebhookClient(webhookClient);
        ctx = ToolContext.of("call-1", ToolCallOrigin.JSON_RPC);
    }

    @Test
    void defaultsToPostAndReturnsResponse() {
        when(webhookClient.exchange(eq("https://hooks.example.test/in"), eq("POST"), anyMap(), any()))
                .thenReturn(new WebhookResponse(200, "OK", "{\"received\":true}"));
        ObjectNode args = MAPPER.createObjectNode().put("url", "https://hooks.example.test/in");
        args.putObject("headers").put("X-Token", "abc");
        args.putObject("body").put("event", "detection");

        ToolResult result = tool.execute(ctx, args);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> headers = ArgumentCaptor.forClass(Map.class);
        ArgumentCaptor<JsonNode> body = ArgumentCaptor.forClass(JsonNode.class);
        verify(webhookClient).exchange(any(), any(), headers.capture(), body.capture());
        assertThat(headers.getValue()).containsEntry("X-Token", "abc");
        assertThat(body.getValue().path("event").asText()).isEqualTo("detection");

        assertThat(result.error()).isFalse();
        assertThat(result.payload().path("status").asInt()).isEqualTo(200);
        assertThat(result.payload().path("response").asText()).isEqualTo("{\"received\":true}");
    }

    @Test
    void nonSuccessStatusIsAnErrorResult() {
        when(webhookClient.exchange(any(), eq("DELETE"), anyMap(), isNull()))
                .thenReturn(new WebhookResponse(500, "Internal Server Error", "oops"));

        ToolResult result = tool.execute(ctx,
                MAPPER.createObjectNode().put("url", "https://hooks.example.test/in").put("method", "DELETE"));

        assertThat(result.error()).isTrue();
        assertThat(result.payload().path("success").asBoolean()).isFalse();
        assertThat(result.payload().path("statusText").asText()).isEqualTo("Internal Server Error");
    }

    @Test
    void unreachableTargetIsAnErrorResult() {
        when(webhookClient.exchange(any(), any(), anyMap(), any()))
                .thenThrow(new ProviderException("webhook", "webhook request failed: Connection refused"));

        ToolResult result = tool.execute(ctx, MAPPER.createObjectNode().put("url", "http://localhost:1/x"));

        assertThat(result.error()).isTrue();
        assertThat(result.payload().path("error").asText()).isEqualTo("webhook request failed: Connection refused");
    }
}
