package io.github.drompincen.lumenta.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActionExecutionResult(
        boolean success,
        String message,
        Object result,
        String error
) {
    public static ActionExecutionResult succeeded(String message, Object result) {
        return new ActionExecutionResult(true, message, result, null);
    }

    public static ActionExecutionResult failed(String message, String error) {
        return new ActionExecutionResult(false, message, null, error);
    }
}
