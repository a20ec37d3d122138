package io.github.drompincen.lumenta.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Checks call arguments against the subset of JSON Schema the tools declare: {@code required},
 * property {@code type}, {@code enum}, and {@code items.enum} for arrays. Unknown properties pass
 * through untouched.
 */
@Component
public class ToolSchemaValidator {

    private final ObjectMapper objectMapper;

    public ToolSchemaValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return the arguments as an object node ({@code null} or missing arguments become {@code {}})
     * @throws InvalidToolArgumentsException on the first class of violation found
     */
    public ObjectNode validate(Tool tool, JsonNode arguments) {
        if (arguments == null || arguments.isNull() || arguments.isMissingNode()) {
            arguments = objectMapper.createObjectNode();
        }
        if (!arguments.isObject()) {
            throw invalidField("arguments", "arguments must be an object");
        }
        ObjectNode args = (ObjectNode) arguments;
        JsonNode schema = tool.inputSchema();

        List<String> missing = new ArrayList<>();
        for (JsonNode required : schema.path("required")) {
            JsonNode value = args.get(required.asText());
            if (value == null || value.isNull()) {
                missing.add(required.asText());
            }
        }
        if (!missing.isEmpty()) {
            ObjectNode data = objectMapper.createObjectNode();
            ArrayNode list = data.putArray("missing");
            missing.forEach(list::add);
            throw new InvalidToolArgumentsException(
                    "Missing required argument(s) for " + tool.name() + ": " + String.join(", ", missing), data);
        }

        Iterator<Map.Entry<String, JsonNode>> properties = schema.path("properties").fields();
        while (properties.hasNext()) {
            Map.Entry<String, JsonNode> property = properties.next();
            JsonNode value = args.get(property.getKey());
            if (value == null || value.isNull()) {
                continue;
            }
            checkProperty(property.getKey(), property.getValue(), value);
        }
        return args;
    }

    private void checkProperty(String name, JsonNode propertySchema, JsonNode value) {
        String type = propertySchema.path("type").asText(null);
        if (type != null && !matchesType(type, value)) {
            throw invalidField(name, name + " must be of type " + type);
        }
        JsonNode allowed = propertySchema.get("enum");
        if (allowed != null && !contains(allowed, value)) {
            throw invalidField(name, name + " must be one of " + allowed);
        }
        JsonNode itemEnum = propertySchema.path("items").get("enum");
        if (value.isArray() && itemEnum != null) {
            for (JsonNode item : value) {
                if (!contains(itemEnum, item)) {
                    throw invalidField(name, name + " entries must be one of " + itemEnum + ", got " + item);
                }
            }
        }
    }

    private static boolean matchesType(String type, JsonNode value) {
        return switch (type) {
            case "string" -> value.isTextual();
            case "object" -> value.isObject();
            case "array" -> value.isArray();
            case "number" -> value.isNumber();
            case "integer" -> value.isIntegralNumber();
            case "boolean" -> value.isBoolean();
            default -> true;
        };
    }

    private static boolean contains(JsonNode allowed, JsonNode value) {
        for (JsonNode candidate : allowed) {
            if (candidate.equals(value)) {
                return true;
            }
        }
        return false;
    }

    private InvalidToolArgumentsException invalidField(String field, String reason) {
        ObjectNode data = objectMapper.createObjectNode();
        data.put("field", field);
        data.put("reason", reason);
        return new InvalidToolArgumentsException("Invalid argument " + field + ": " + reason, data);
    }
}
