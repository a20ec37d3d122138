package io.github.drompincen.lumenta.runtime.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.lumenta.runtime.config.LumentaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Sends e-mail through the Resend REST API. When Resend rejects an unverified sender domain the
 * message was not delivered, so it is re-sent once from Resend's shared onboarding address.
 */
@Component
public class ResendEmailSender implements EmailSender {

    private static final Logger log = LoggerFactory.getLogger(ResendEmailSender.class);
    private static final String PROVIDER = "resend";

    public static final String DEFAULT_SENDER = "onboarding@resend.dev";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final LumentaProperties.Resend settings;

    public ResendEmailSender(HttpClient httpClient, ObjectMapper objectMapper, LumentaProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.settings = properties.getResend();
    }

    @Override
    public EmailReceipt send(EmailMessage message) {
        if (HttpCalls.isBlank(settings.getApiKey())) {
            throw new ProviderException(PROVIDER, "Resend API key is not configured (lumenta.resend.api-key)");
        }
        String from = !HttpCalls.isBlank(message.from()) ? message.from()
                : !HttpCalls.isBlank(settings.getFromEmail()) ? settings.getFromEmail()
                : DEFAULT_SENDER;

        HttpResponse<String> response = post(message, from);
        JsonNode body = parse(response.body());
        boolean fallback = false;

        if (!ok(response) && errorMessage(body).contains("domain is not verified") && !DEFAULT_SENDER.equals(from)) {
            log.warn("Sender domain of {} is not verified, re-sending from {}", from, DEFAULT_SENDER);
            from = DEFAULT_SENDER;
            fallback = true;
            response = post(message, from);
            body = parse(response.body());
        }
        if (!ok(response)) {
            String detail = errorMessage(body);
            throw new ProviderException(PROVIDER, "Resend API error: "
                    + (detail.isEmpty() ? "HTTP " + response.statusCode() : detail));
        }
        return new EmailReceipt(body.path("id").asText(null), from, fallback);
    }

    private HttpResponse<String> post(EmailMessage message, String from) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("from", from);
        payload.put("to", message.to());
        payload.put("subject", message.subject());
        if (message.html() != null) {
            payload.put("html", message.html());
        }
        if (message.text() != null) {
            payload.put("text", message.text());
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(settings.getBaseUrl() + "/emails"))
                .timeout(Duration.ofSeconds(30))
                .header("Authorization", "Bearer " + settings.getApiKey())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload.toString()))
                .build();
        return HttpCalls.send(httpClient, request, PROVIDER);
    }

    private JsonNode parse(String body) {
        try {
            return body == null || body.isBlank() ? MissingNode.getInstance() : objectMapper.readTree(body);
        } catch (Exception e) {
            return MissingNode.getInstance();
        }
    }

    private static boolean ok(HttpResponse<?> response) {
        return response.statusCode() >= 200 && response.statusCode() < 300;
    }

    private static String errorMessage(JsonNode body) {
        return body.path("message").asText("");
    }
}
