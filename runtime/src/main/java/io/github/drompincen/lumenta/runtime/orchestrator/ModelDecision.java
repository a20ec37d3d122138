package io.github.drompincen.lumenta.runtime.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.lumenta.runtime.llm.ModelJson;

import java.util.ArrayList;
import java.util.List;

/**
 * The model's answer to a decision prompt: {@code {reasoning, toolCalls: [{name, arguments}]}}.
 */
public record ModelDecision(
        String reasoning,
        List<ToolCallRequest> toolCalls
) {
    public record ToolCallRequest(String name, JsonNode arguments) {}

    /**
     * @throws io.github.drompincen.lumenta.runtime.llm.ModelResponseParseException when the text holds no JSON object
     */
    public static ModelDecision parse(ObjectMapper mapper, String text) {
        JsonNode root = ModelJson.parseObject(mapper, text);
        List<ToolCallRequest> calls = new ArrayList<>();
        for (JsonNode call : root.path("toolCalls")) {
            String name = call.path("name").asText(null);
            if (name == null || name.isBlank()) {
                continue;
            }
            JsonNode arguments = call.path("arguments");
            calls.add(new ToolCallRequest(name, arguments.isObject() ? arguments : mapper.createObjectNode()));
        }
        return new ModelDecision(root.path("reasoning").asText(null), List.copyOf(calls));
    }
}
