package io.github.drompincen.lumenta.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Tool arguments rejected by schema validation. {@code data} is either {@code {missing: [...]}}
 * or {@code {field, reason}}.
 */
public class InvalidToolArgumentsException extends RuntimeException {

    private final JsonNode data;

    public InvalidToolArgumentsException(String message, JsonNode data) {
        super(message);
        this.data = data;
    }

    public JsonNode data() {
        return data;
    }
}
