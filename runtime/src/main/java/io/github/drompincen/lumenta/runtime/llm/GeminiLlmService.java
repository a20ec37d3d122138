package io.github.drompincen.lumenta.runtime.llm;

import io.github.drompincen.lumenta.runtime.config.LumentaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.ai.openai.api.ResponseFormat;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Gemini through Spring AI's OpenAI client pointed at Google's OpenAI-compatible endpoint.
 * Callers may bring their own key per request. Only the chat model of the most recently used key is
 * kept; a different key replaces it.
 */
@Service
public class GeminiLlmService implements LlmService {

    private static final Logger log = LoggerFactory.getLogger(GeminiLlmService.class);

    private final LumentaProperties.Gemini settings;
    private final AtomicReference<KeyedModel> current = new AtomicReference<>();

    public GeminiLlmService(LumentaProperties properties) {
        this.settings = properties.getGemini();
        log.info("GeminiLlmService initialized: model={}, key={}", settings.getModel(),
                hasText(settings.getApiKey()) ? "configured" : "missing");
    }

    @Override
    public String blockingResponse(LlmRequest request) {
        String apiKey = hasText(request.apiKey()) ? request.apiKey() : settings.getApiKey();
        if (!hasText(apiKey)) {
            throw new LlmException("Gemini API key is required: pass apiKey or set lumenta.gemini.api-key (GEMINI_API_KEY)");
        }
        ChatModel model = modelFor(apiKey);

        OpenAiChatOptions.Builder options = OpenAiChatOptions.builder()
                .model(settings.getModel())
                .temperature(request.temperature())
                .maxTokens(request.maxTokens());
        if (request.jsonResponse()) {
            options.responseFormat(ResponseFormat.builder().type(ResponseFormat.Type.JSON_OBJECT).build());
        }

        ChatResponse response;
        try {
            response = model.call(new Prompt(request.prompt(), options.build()));
        } catch (RuntimeException e) {
            throw new LlmException("Gemini API call failed: " + e.getMessage(), e);
        }
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new LlmException("No response text from Gemini API");
        }
        String text = response.getResult().getOutput().getText();
        if (!hasText(text)) {
            throw new LlmException("No response text from Gemini API");
        }
        log.debug("Gemini returned {} chars", text.length());
        return text;
    }

    private ChatModel modelFor(String apiKey) {
        KeyedModel cached = current.get();
        if (cached != null && cached.apiKey().equals(apiKey)) {
            return cached.model();
        }
        ChatModel model = createModel(apiKey);
        current.set(new KeyedModel(apiKey, model));
        return model;
    }

    protected ChatModel createModel(String apiKey) {
        OpenAiApi api = OpenAiApi.builder()
                .baseUrl(settings.getBaseUrl())
                .completionsPath(settings.getCompletionsPath())
                .apiKey(apiKey)
                .build();
        OpenAiChatOptions defaults = OpenAiChatOptions.builder()
                .model(settings.getModel())
                .temperature(settings.getTemperature())
                .maxTokens(settings.getMaxTokens())
                .build();
        log.info("Created Gemini chat model {} (lazy)", settings.getModel());
        return OpenAiChatModel.builder().openAiApi(api).defaultOptions(defaults).build();
    }

    private record KeyedModel(String apiKey, ChatModel model) {
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
