package io.github.drompincen.lumenta.protocol.resource;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeExecutionTrace(
        String id,
        String workflowId,
        String nodeId,
        String nodeType,
        Instant timestamp,
        TraceStatus status,
        Map<String, Object> input,
        Map<String, Object> output,
        String error,
        Long duration
) implements StoredResource {

    public NodeExecutionTrace {
        input = Payloads.freeze(input);
        output = Payloads.freeze(output);
    }

    @Override
    public ResourceKind kind() {
        return ResourceKind.TRACE;
    }

    @Override
    public NodeExecutionTrace withDefaults(String generatedId, Instant now) {
        if (id != null && timestamp != null) {
            return this;
        }
        return new NodeExecutionTrace(id != null ? id : generatedId, workflowId, nodeId, nodeType,
                timestamp != null ? timestamp : now, status, input, output, error, duration);
    }
}
