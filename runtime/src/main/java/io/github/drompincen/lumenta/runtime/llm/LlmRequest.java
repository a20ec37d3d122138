package io.github.drompincen.lumenta.runtime.llm;

/**
 * One completion request. {@code apiKey} overrides the configured key when non-blank;
 * {@code jsonResponse} asks the model for a bare JSON object.
 */
public record LlmRequest(
        String apiKey,
        String prompt,
        double temperature,
        int maxTokens,
        boolean jsonResponse
) {}
