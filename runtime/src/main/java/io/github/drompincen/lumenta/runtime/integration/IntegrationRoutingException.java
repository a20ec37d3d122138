package io.github.drompincen.lumenta.runtime.integration;

public class IntegrationRoutingException extends RuntimeException {

    public IntegrationRoutingException(String message) {
        super(message);
    }

    public IntegrationRoutingException(String message, Throwable cause) {
        super(message, cause);
    }
}
