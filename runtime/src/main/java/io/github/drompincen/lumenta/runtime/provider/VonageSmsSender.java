package io.github.drompincen.lumenta.runtime.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.lumenta.runtime.config.LumentaProperties;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Sends SMS through the Vonage (Nexmo) SMS API. A message status of {@code "0"} means accepted.
 */
@Component
public class VonageSmsSender implements SmsSender {

    private static final String PROVIDER = "vonage";

    /** Concatenated-message ceiling. */
    public static final int MAX_LENGTH = 1600;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final LumentaProperties.Vonage settings;

    public VonageSmsSender(HttpClient httpClient, ObjectMapper objectMapper, LumentaProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.settings = properties.getVonage();
    }

    @Override
    public SmsReceipt send(String to, String text) {
        if (HttpCalls.isBlank(settings.getApiKey()) || HttpCalls.isBlank(settings.getApiSecret())) {
            throw new ProviderException(PROVIDER,
                    "Vonage API key and secret are required (lumenta.vonage.api-key, lumenta.vonage.api-secret)");
        }
        if (to == null || !to.startsWith("+")) {
            throw new ProviderException(PROVIDER,
                    "Phone number must include country code (e.g., +1234567890). You provided: " + to);
        }

        Map<String, String> form = new LinkedHashMap<>();
        form.put("api_key", settings.getApiKey());
        form.put("api_secret", settings.getApiSecret());
        form.put("from", settings.getFromNumber());
        form.put("to", to.substring(1));
        form.put("text", truncate(text));

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(settings.getBaseUrl() + "/sms/json"))
                .timeout(Duration.ofSeconds(30))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(encode(form)))
                .build();
        HttpResponse<String> response = HttpCalls.send(httpClient, request, PROVIDER);

        JsonNode body;
        try {
            body = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            String raw = response.body() == null ? "" : response.body();
            throw new ProviderException(PROVIDER, "Vonage API returned invalid JSON (status " + response.statusCode()
                    + "): " + raw.substring(0, Math.min(raw.length(), 300)));
        }
        JsonNode messages = body.path("messages");
        if (!messages.isArray() || messages.isEmpty()) {
            throw new ProviderException(PROVIDER, "Vonage API returned no messages in response");
        }
        JsonNode first = messages.get(0);
        String status = first.path("status").asText("");
        if (!"0".equals(status)) {
            throw new ProviderException(PROVIDER, describeFailure(status, first.path("error-text").asText(null)));
        }
        return new SmsReceipt(first.path("message-id").asText(null), to, settings.getFromNumber(), status,
                first.path("remaining-balance").asText(null));
    }

    static String truncate(String text) {
        if (text == null || text.length() <= MAX_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_LENGTH - 3) + "...";
    }

    private static String describeFailure(String status, String errorText) {
        StringBuilder message = new StringBuilder("Vonage SMS API error (status ").append(status).append(')');
        if (errorText != null) {
            message.append(": ").append(errorText);
        }
        String hint = switch (status) {
            case "1", "2" -> "check lumenta.vonage.api-key and lumenta.vonage.api-secret";
            case "3" -> "invalid phone number format, include the country code";
            case "4" -> "invalid sender id, check lumenta.vonage.from-number";
            case "6", "7", "8" -> "message rejected, check the account balance and message content";
            case "9", "10", "11" -> "rate limited, try again later";
            default -> null;
        };
        if (hint != null) {
            message.append(" (").append(hint).append(')');
        }
        return message.toString();
    }

    private static String encode(Map<String, String> form) {
        return form.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue() == null ? "" : e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
