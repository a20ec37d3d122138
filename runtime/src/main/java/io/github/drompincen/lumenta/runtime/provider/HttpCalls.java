package io.github.drompincen.lumenta.runtime.provider;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

final class HttpCalls {

    private HttpCalls() {}

    static HttpResponse<String> send(HttpClient client, HttpRequest request, String provider) {
        try {
            return client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ProviderException(provider, provider + " request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(provider, provider + " request interrupted", e);
        }
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
