package io.github.drompincen.lumenta.runtime.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Extracts the JSON object from model output. Models wrap JSON in markdown fences or add a
 * sentence of prose around it often enough that both are tolerated.
 */
public final class ModelJson {

    private ModelJson() {}

    public static JsonNode parseObject(ObjectMapper mapper, String text) {
        if (text == null || text.isBlank()) {
            throw new ModelResponseParseException("Model returned an empty response");
        }
        String json = stripFences(text.trim());
        int start = json.indexOf('{');
        int end = json.lastIndexOf('}');
        if (start < 0 || end < start) {
            throw new ModelResponseParseException("No JSON object in model response");
        }
        try {
            JsonNode node = mapper.readTree(json.substring(start, end + 1));
            if (!node.isObject()) {
                throw new ModelResponseParseException("Model response is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new ModelResponseParseException("Model response is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    static String stripFences(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        String body = firstNewline < 0 ? "" : text.substring(firstNewline + 1);
        int closing = body.lastIndexOf("```");
        return (closing >= 0 ? body.substring(0, closing) : body).trim();
    }
}
