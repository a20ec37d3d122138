package io.github.drompincen.lumenta.protocol.api;

public record ActionRequest(
        ActionConfig config,
        String apiKey
) {
    public record ActionConfig(String option, String description) {}
}
