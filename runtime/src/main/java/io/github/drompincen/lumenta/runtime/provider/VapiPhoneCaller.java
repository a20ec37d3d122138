package io.github.drompincen.lumenta.runtime.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.lumenta.runtime.config.LumentaProperties;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Places outbound calls through Vapi. The spoken script lives in the Vapi assistant; only the
 * phone-number id, assistant id and customer number are sent.
 */
@Component
public class VapiPhoneCaller implements PhoneCaller {

    private static final String PROVIDER = "vapi";
    private static final Pattern UUID = Pattern.compile(
            "^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$", Pattern.CASE_INSENSITIVE);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final LumentaProperties.Vapi settings;

    public VapiPhoneCaller(HttpClient httpClient, ObjectMapper objectMapper, LumentaProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.settings = properties.getVapi();
    }

    @Override
    public CallReceipt call(String to, String assistantId) {
        if (HttpCalls.isBlank(settings.getApiKey())) {
            throw new ProviderException(PROVIDER, "Vapi API key is required (lumenta.vapi.api-key)");
        }
        String phoneNumberId = settings.getPhoneNumberId();
        if (HttpCalls.isBlank(phoneNumberId)) {
            throw new ProviderException(PROVIDER,
                    "Vapi phone number id is required (lumenta.vapi.phone-number-id); use the UUID from the Vapi dashboard");
        }
        if (!isUuid(phoneNumberId)) {
            throw new ProviderException(PROVIDER, "Vapi phone number id must be a UUID, not a phone number. You provided \""
                    + phoneNumberId + "\"");
        }
        if (HttpCalls.isBlank(to)) {
            throw new ProviderException(PROVIDER, "Phone number is required. Provide the 'to' argument.");
        }
        String assistant = !HttpCalls.isBlank(assistantId) ? assistantId : settings.getAssistantId();
        if (HttpCalls.isBlank(assistant)) {
            throw new ProviderException(PROVIDER,
                    "Vapi assistant id is required: configure lumenta.vapi.assistant-id or pass assistantId");
        }
        if (!isUuid(assistant)) {
            throw new ProviderException(PROVIDER, "Vapi assistant id must be a UUID. You provided \"" + assistant + "\"");
        }

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("phoneNumberId", phoneNumberId);
        payload.put("assistantId", assistant);
        payload.putObject("customer").put("number", to);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(settings.getBaseUrl() + "/call"))
                .timeout(Duration.ofSeconds(30))
                .header("Authorization", "Bearer " + settings.getApiKey())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload.toString()))
                .build();
        HttpResponse<String> response = HttpCalls.send(httpClient, request, PROVIDER);

        JsonNode body = readQuietly(response.body());
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            String detail = body.path("message").isTextual() ? body.path("message").asText()
                    : body.path("message").isArray() ? body.path("message").toString()
                    : "HTTP " + response.statusCode();
            throw new ProviderException(PROVIDER, "Vapi API error: " + detail);
        }
        return new CallReceipt(body.path("id").asText(null), body.path("status").asText(null));
    }

    static boolean isUuid(String value) {
        return value != null && UUID.matcher(value).matches();
    }

    private JsonNode readQuietly(String body) {
        try {
            return body == null || body.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(body);
        } catch (Exception e) {
            return objectMapper.createObjectNode();
        }
    }
}
