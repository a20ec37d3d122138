package io.github.drompincen.lumenta.runtime.llm;

public class ModelResponseParseException extends RuntimeException {

    public ModelResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }

    public ModelResponseParseException(String message) {
        super(message);
    }
}
