package io.github.drompincen.lumenta.runtime.llm;

public interface LlmService {

    /**
     * Sends one prompt and returns the model's text.
     *
     * @throws LlmException when no API key is available or the model call fails
     */
    String blockingResponse(LlmRequest request);
}
