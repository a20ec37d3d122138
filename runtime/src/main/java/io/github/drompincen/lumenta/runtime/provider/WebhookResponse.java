package io.github.drompincen.lumenta.runtime.provider;

public record WebhookResponse(
        int status,
        String statusText,
        String body
) {
    public boolean ok() {
        return status >= 200 && status < 300;
    }
}
