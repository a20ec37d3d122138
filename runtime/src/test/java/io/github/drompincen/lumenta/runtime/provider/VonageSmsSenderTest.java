package io.github.drompincen.lumenta.runtime.provider;

import io.github.drompincen.lumenta.protocol.Json;
import io.github.drompincen.lumenta.runtime.config.LumentaProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class VonageSmsSenderTest {

    @Mock
    private HttpClient httpClient;

    private LumentaProperties properties;
    private VonageSmsSender sender;

    @BeforeEach
    void setUp() {
        properties = new LumentaProperties();
        properties.getVonage().setApiKey("key");
        properties.getVonage().setApiSecret("secret");
        sender = new VonageSmsSender(httpClient, Json.newMapper(), properties);
    }

    @Test
    void acceptedMessageReturnsReceipt() throws Exception {
        doReturn(new StubHttpResponse(200, """
                {"message-count":"1","messages":[{"to":"15551234567","message-id":"m-1","status":"0",
                "remaining-balance":"9.50"}]}
                """)).when(httpClient).send(any(), any());

        SmsReceipt receipt = sender.send("+15551234567", "Person at back door");

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        assertThat(captor.getValue().uri().toString()).isEqualTo("https://rest.nexmo.com/sms/json");
        assertThat(receipt.messageId()).isEqualTo("m-1");
        assertThat(receipt.recipient()).isEqualTo("+15551234567");
        assertThat(receipt.from()).isEqualTo("Lumenta");
        assertThat(receipt.remainingBalance()).isEqualTo("9.50");
    }

    @Test
    void nonZeroStatusIsAFailureWithHint() throws Exception {
        doReturn(new StubHttpResponse(200,
                "{\"messages\":[{\"status\":\"2\",\"error-text\":\"Missing api_key\"}]}"))
                .when(httpClient).send(any(), any());

        assertThatThrownBy(() -> sender.send("+15551234567", "hi"))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("status 2")
                .hasMessageContaining("Missing api_key")
                .hasMessageContaining("lumenta.vonage.api-key");
    }

    @Test
    void recipientWithoutCountryCodeIsRejected() {
        assertThatThrownBy(() -> sender.send("5551234567", "hi"))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("country code");
        verifyNoInteractions(httpClient);
    }

    @Test
    void missingCredentialsAreRejected() {
        properties.getVonage().setApiSecret(null);

        assertThatThrownBy(() -> sender.send("+15551234567", "hi"))
                .hasMessageContaining("Vonage API key and secret are required");
        verifyNoInteractions(httpClient);
    }

    @Test
    void emptyMessagesArrayIsAFailure() throws Exception {
        doReturn(new StubHttpResponse(200, "{\"messages\":[]}")).when(httpClient).send(any(), any());

        assertThatThrownBy(() -> sender.send("+15551234567", "hi"))
                .hasMessage("Vonage API returned no messages in response");
    }

    @Test
    void invalidJsonIsReportedWithStatus() throws Exception {
        doReturn(new StubHttpResponse(502, "<html>bad gateway</html>")).when(httpClient).send(any(), any());

        assertThatThrownBy(() -> sender.send("+15551234567", "hi"))
                .hasMessageContaining("invalid JSON (status 502)");
    }

    @Test
    void longTextIsTruncated() {
        String text = "x".repeat(2000);

        String truncated = VonageSmsSender.truncate(text);

        assertThat(truncated).hasSize(VonageSmsSender.MAX_LENGTH).endsWith("...");
        assertThat(VonageSmsSender.truncate("short")).isEqualTo("short");
    }
}
