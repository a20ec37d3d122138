package io.github.drompincen.lumenta.protocol.api;

/**
 * {@code interval} is in milliseconds.
 */
public record OrchestratorRequest(
        String action,
        String apiKey,
        Long interval
) {}
