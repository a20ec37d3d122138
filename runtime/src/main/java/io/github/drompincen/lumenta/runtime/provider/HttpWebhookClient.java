package io.github.drompincen.lumenta.runtime.provider;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

@Component
public class HttpWebhookClient implements WebhookClient {

    private static final String PROVIDER = "webhook";

    private final HttpClient httpClient;

    public HttpWebhookClient(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public WebhookResponse exchange(String url, String method, Map<String, String> headers, JsonNode body) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new ProviderException(PROVIDER, "Invalid webhook URL: " + url, e);
        }
        if (uri.getScheme() == null || !(uri.getScheme().equals("http") || uri.getScheme().equals("https"))) {
            throw new ProviderException(PROVIDER, "Webhook URL must be http or https: " + url);
        }

        HttpRequest.BodyPublisher publisher = body == null || body.isNull() || "GET".equals(method)
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body.toString());
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(Duration.ofSeconds(30))
                .header("Content-Type", "application/json")
                .method(method, publisher);
        if (headers != null) {
            try {
                headers.forEach(builder::setHeader);
            } catch (IllegalArgumentException e) {
                throw new ProviderException(PROVIDER, "Invalid webhook header: " + e.getMessage(), e);
            }
        }

        HttpResponse<String> response = HttpCalls.send(httpClient, builder.build(), PROVIDER);
        HttpStatus status = HttpStatus.resolve(response.statusCode());
        return new WebhookResponse(response.statusCode(), status != null ? status.getReasonPhrase() : "",
                response.body());
    }
}
