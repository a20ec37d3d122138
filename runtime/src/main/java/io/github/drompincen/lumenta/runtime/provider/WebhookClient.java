package io.github.drompincen.lumenta.runtime.provider;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public interface WebhookClient {

    /**
     * Sends one request and returns whatever the target answered, including non-2xx statuses.
     *
     * @throws ProviderException when the URL is invalid or the target cannot be reached
     */
    WebhookResponse exchange(String url, String method, Map<String, String> headers, JsonNode body);
}
